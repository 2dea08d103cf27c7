package com.optiontracker.domain.model;

import com.optiontracker.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of an option chain: quotes and Greeks for a single contract.
 *
 * <p>Bid and ask feed the MarkPriceDeriver when the user picks a contract for a position.
 * Either may be null when the service has no quote for that side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionContract {

    private String ticker;
    private LocalDate expiration;
    private BigDecimal strike;
    private OptionType optionType;

    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal lastPrice;

    private long volume;

    /** Open interest: total outstanding contracts. */
    private long openInterest;

    private BigDecimal impliedVolatility;

    private BigDecimal delta;
    private BigDecimal gamma;
    private BigDecimal theta;
    private BigDecimal vega;
    private BigDecimal rho;

    private boolean inTheMoney;
}

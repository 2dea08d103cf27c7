package com.optiontracker.api.dto.response;

import com.optiontracker.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the option chain table, with the mark price a new position would start from.
 */
@Data
@NoArgsConstructor
public class OptionChainEntryResponse {

    private String ticker;
    private LocalDate expiration;
    private BigDecimal strike;
    private OptionType optionType;
    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal lastPrice;

    /** Bid/ask midpoint, or the only quoted side. Null when neither side is quoted. */
    private BigDecimal markPrice;

    private long volume;
    private long openInterest;
    private BigDecimal impliedVolatility;
    private BigDecimal delta;
    private BigDecimal gamma;
    private BigDecimal theta;
    private BigDecimal vega;
    private BigDecimal rho;
    private boolean inTheMoney;
}

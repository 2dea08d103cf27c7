package com.optiontracker.pricing.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.optiontracker.domain.enums.OptionType;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire shape of an option chain row. The service has used both {@code last} and
 * {@code last_price} for the last traded price.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OptionContractResponse {

    private String ticker;
    private String expiration;
    private BigDecimal strike;
    private OptionType optionType;
    private BigDecimal bid;
    private BigDecimal ask;

    @JsonAlias("last")
    private BigDecimal lastPrice;

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

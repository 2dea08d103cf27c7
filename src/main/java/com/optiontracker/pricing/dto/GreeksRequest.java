package com.optiontracker.pricing.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.optiontracker.domain.enums.OptionType;
import com.optiontracker.domain.enums.PositionAction;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire body of {@code POST /greeks/calculate}. Action and quantity let the service
 * return Greeks already scaled for the position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GreeksRequest {

    private String positionId;
    private String ticker;

    /** ISO date (yyyy-MM-dd). */
    private String expiration;

    private BigDecimal strike;
    private OptionType optionType;
    private PositionAction action;
    private int quantity;
}

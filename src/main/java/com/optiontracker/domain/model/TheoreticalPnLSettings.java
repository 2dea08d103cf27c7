package com.optiontracker.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Scenario used for every theoretical P&L calculation until the user changes it.
 */
@Value
@Builder(toBuilder = true)
public class TheoreticalPnLSettings {

    /** Days to project forward. Never negative. */
    int daysForward;

    /** Underlying price shift in percent. 0 means no change. */
    BigDecimal priceChangePercent;

    public static TheoreticalPnLSettings defaults() {
        return TheoreticalPnLSettings.builder()
                .daysForward(0)
                .priceChangePercent(BigDecimal.ZERO)
                .build();
    }
}

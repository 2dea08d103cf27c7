package com.optiontracker.domain.model;

import com.optiontracker.domain.enums.CalculationMetric;
import com.optiontracker.domain.enums.CalculationState;
import lombok.Builder;
import lombok.Value;

/**
 * Terminal result of running one (position, metric) calculation.
 *
 * <p>{@code state} is always SUCCEEDED, FALLBACK or FAILED. For P&L metrics {@code value}
 * is never null (a FAILED outcome carries an error-flagged PnLResult); for Greeks a
 * FAILED outcome has a null value and the reason in {@code error}.
 *
 * @param <T> Greeks or PnLResult
 */
@Value
@Builder
public class CalculationOutcome<T> {

    String positionId;
    CalculationMetric metric;
    CalculationState state;
    T value;
    String error;

    /** Remote attempts made (0 when the batch went straight to local fallback). */
    int attempts;

    public boolean isSucceeded() {
        return state == CalculationState.SUCCEEDED;
    }

    public boolean isFallback() {
        return state == CalculationState.FALLBACK;
    }

    public boolean isFailed() {
        return state == CalculationState.FAILED;
    }
}

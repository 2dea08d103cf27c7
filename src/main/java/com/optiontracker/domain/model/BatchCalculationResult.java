package com.optiontracker.domain.model;

import com.optiontracker.domain.enums.CalculationMetric;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of a recalculation over the whole position book.
 */
@Value
@Builder
public class BatchCalculationResult {

    CalculationMetric metric;
    List<CalculationOutcome<?>> outcomes;

    /** True if the probe call found the service unavailable and every position was calculated locally. */
    boolean probeShortCircuited;

    LocalDateTime startedAt;
    LocalDateTime completedAt;

    public long getSucceededCount() {
        return outcomes.stream().filter(CalculationOutcome::isSucceeded).count();
    }

    public long getFallbackCount() {
        return outcomes.stream().filter(CalculationOutcome::isFallback).count();
    }

    public long getFailedCount() {
        return outcomes.stream().filter(CalculationOutcome::isFailed).count();
    }
}

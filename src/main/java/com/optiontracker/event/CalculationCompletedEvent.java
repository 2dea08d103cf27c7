package com.optiontracker.event;

import com.optiontracker.domain.model.BatchCalculationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the CalculationOrchestrator after a batch recalculation has settled and
 * its results are visible in the position book.
 *
 * <p>Single-position recalculations are reported as a batch of one.
 */
public class CalculationCompletedEvent extends ApplicationEvent {

    private final BatchCalculationResult result;

    public CalculationCompletedEvent(Object source, BatchCalculationResult result) {
        super(source);
        this.result = result;
    }

    public BatchCalculationResult getResult() {
        return result;
    }
}

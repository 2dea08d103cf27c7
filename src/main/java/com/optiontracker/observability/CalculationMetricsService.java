package com.optiontracker.observability;

import com.optiontracker.domain.enums.CalculationState;
import com.optiontracker.domain.model.BatchCalculationResult;
import com.optiontracker.domain.model.CalculationOutcome;
import com.optiontracker.event.CalculationCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the calculation orchestrator:
 * <ul>
 *   <li><b>calculation.outcomes</b> (counter, tags metric/state): one increment per position
 *       per recalculation</li>
 *   <li><b>calculation.probe.short_circuits</b> (counter, tag metric): batches sent straight
 *       to local fallback by the probe</li>
 *   <li><b>calculation.batch.duration</b> (timer, tag metric)</li>
 * </ul>
 */
@Service
public class CalculationMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CalculationMetricsService.class);

    private final MeterRegistry meterRegistry;

    public CalculationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    public void onCalculationCompleted(CalculationCompletedEvent event) {
        BatchCalculationResult result = event.getResult();
        String metric = result.getMetric().name();

        for (CalculationOutcome<?> outcome : result.getOutcomes()) {
            outcomeCounter(metric, outcome.getState()).increment();
        }
        if (result.isProbeShortCircuited()) {
            Counter.builder("calculation.probe.short_circuits")
                    .description("Batches calculated locally after a failed probe")
                    .tag("metric", metric)
                    .register(meterRegistry)
                    .increment();
        }
        if (result.getStartedAt() != null && result.getCompletedAt() != null) {
            Timer.builder("calculation.batch.duration")
                    .description("Wall time of a batch recalculation")
                    .tag("metric", metric)
                    .register(meterRegistry)
                    .record(Duration.between(result.getStartedAt(), result.getCompletedAt()));
        }

        log.debug(
                "{} batch: {} succeeded, {} fallback, {} failed",
                metric,
                result.getSucceededCount(),
                result.getFallbackCount(),
                result.getFailedCount());
    }

    private Counter outcomeCounter(String metric, CalculationState state) {
        return Counter.builder("calculation.outcomes")
                .description("Per-position calculation results by terminal state")
                .tag("metric", metric)
                .tag("state", state.name())
                .register(meterRegistry);
    }
}

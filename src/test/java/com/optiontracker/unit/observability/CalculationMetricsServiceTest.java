package com.optiontracker.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.optiontracker.domain.enums.CalculationMetric;
import com.optiontracker.domain.enums.CalculationState;
import com.optiontracker.domain.model.BatchCalculationResult;
import com.optiontracker.domain.model.CalculationOutcome;
import com.optiontracker.event.CalculationCompletedEvent;
import com.optiontracker.observability.CalculationMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CalculationMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private CalculationMetricsService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new CalculationMetricsService(registry);
    }

    @Test
    void countsOutcomesByState() {
        publish(batch(
                false,
                outcome("p1", CalculationState.SUCCEEDED),
                outcome("p2", CalculationState.SUCCEEDED),
                outcome("p3", CalculationState.FAILED)));

        assertThat(registry.get("calculation.outcomes")
                        .tags("metric", "PNL", "state", "SUCCEEDED")
                        .counter()
                        .count())
                .isEqualTo(2.0);
        assertThat(registry.get("calculation.outcomes")
                        .tags("metric", "PNL", "state", "FAILED")
                        .counter()
                        .count())
                .isEqualTo(1.0);
        assertThat(registry.find("calculation.probe.short_circuits").counter()).isNull();
    }

    @Test
    void countsProbeShortCircuit() {
        publish(batch(true, outcome("p1", CalculationState.FALLBACK)));
        publish(batch(true, outcome("p1", CalculationState.FALLBACK)));

        assertThat(registry.get("calculation.probe.short_circuits")
                        .tag("metric", "PNL")
                        .counter()
                        .count())
                .isEqualTo(2.0);
    }

    @Test
    void recordsBatchDuration() {
        publish(batch(false, outcome("p1", CalculationState.SUCCEEDED)));

        assertThat(registry.get("calculation.batch.duration").timer().count()).isEqualTo(1);
        assertThat(registry.get("calculation.batch.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(1500.0);
    }

    private void publish(BatchCalculationResult result) {
        service.onCalculationCompleted(new CalculationCompletedEvent(this, result));
    }

    private static BatchCalculationResult batch(boolean shortCircuited, CalculationOutcome<?>... outcomes) {
        LocalDateTime start = LocalDateTime.of(2025, 3, 10, 10, 0, 0);
        return BatchCalculationResult.builder()
                .metric(CalculationMetric.PNL)
                .outcomes(List.of(outcomes))
                .probeShortCircuited(shortCircuited)
                .startedAt(start)
                .completedAt(start.plusNanos(1_500_000_000L))
                .build();
    }

    private static CalculationOutcome<?> outcome(String id, CalculationState state) {
        return CalculationOutcome.builder()
                .positionId(id)
                .metric(CalculationMetric.PNL)
                .state(state)
                .attempts(1)
                .build();
    }
}

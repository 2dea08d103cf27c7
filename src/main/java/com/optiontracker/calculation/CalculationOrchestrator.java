package com.optiontracker.calculation;

import com.optiontracker.config.CalculationProperties;
import com.optiontracker.domain.enums.CalculationMetric;
import com.optiontracker.domain.enums.CalculationState;
import com.optiontracker.domain.model.BatchCalculationResult;
import com.optiontracker.domain.model.CalculationOutcome;
import com.optiontracker.domain.model.Greeks;
import com.optiontracker.domain.model.PnLResult;
import com.optiontracker.domain.model.Position;
import com.optiontracker.domain.model.TheoreticalPnLSettings;
import com.optiontracker.event.CalculationCompletedEvent;
import com.optiontracker.event.PositionRemovedEvent;
import com.optiontracker.exception.PricingServiceException;
import com.optiontracker.position.PositionBook;
import com.optiontracker.pricing.PricingServiceClient;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Drives Greeks, P&L and theoretical P&L calculations against the pricing service.
 *
 * <p>Each (position, metric) pair runs a small state machine:
 * <pre>
 *   IDLE -> REQUESTING -> SUCCEEDED
 *                      -> FALLBACK   (P&L metrics only: 404/501 or unreachable)
 *                      -> RETRYING -> REQUESTING ... -> FAILED after maxRetries retries
 * </pre>
 * Retries wait {@code retryDelay} through the injected {@link RetryDelayer} and ask the
 * service to recompute instead of serving its own cached value. A calculation never
 * throws: every path ends in SUCCEEDED, FALLBACK or FAILED with an error-flagged result.
 *
 * <p><b>Batches:</b> {@link #recalculateAll} fans positions out on the calculation
 * executor, waits for every one to settle, then publishes all results to the
 * {@link PositionBook} in a single swap. A slow or failing position never blocks or
 * discards the others.
 *
 * <p><b>Probe:</b> for P&L metrics one representative position is requested first. If
 * the service reports the capability as not implemented or cannot be reached, the whole
 * batch is calculated locally without further remote calls.
 */
@Service
public class CalculationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CalculationOrchestrator.class);

    private final PricingServiceClient pricingServiceClient;
    private final PositionBook positionBook;
    private final LocalPnLCalculator localPnLCalculator;
    private final TheoreticalPnLSettingsService settingsService;
    private final CalculationProperties properties;
    private final RetryDelayer retryDelayer;
    private final Executor calculationExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, CalculationState> states = new ConcurrentHashMap<>();

    public CalculationOrchestrator(
            PricingServiceClient pricingServiceClient,
            PositionBook positionBook,
            LocalPnLCalculator localPnLCalculator,
            TheoreticalPnLSettingsService settingsService,
            CalculationProperties properties,
            RetryDelayer retryDelayer,
            @Qualifier("calculationExecutor") Executor calculationExecutor,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.pricingServiceClient = pricingServiceClient;
        this.positionBook = positionBook;
        this.localPnLCalculator = localPnLCalculator;
        this.settingsService = settingsService;
        this.properties = properties;
        this.retryDelayer = retryDelayer;
        this.calculationExecutor = calculationExecutor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /** Current state of the (position, metric) pair. IDLE if it never ran. */
    public CalculationState getState(String positionId, CalculationMetric metric) {
        return states.getOrDefault(stateKey(positionId, metric), CalculationState.IDLE);
    }

    /** Drops the states of a removed position. */
    @EventListener
    public void onPositionRemoved(PositionRemovedEvent event) {
        forget(event.getPositionId());
    }

    // ========================
    // BATCH
    // ========================

    /**
     * Recalculates {@code metric} for every position in the book.
     */
    public BatchCalculationResult recalculateAll(CalculationMetric metric) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        List<Position> snapshot = positionBook.findAll();
        if (snapshot.isEmpty()) {
            return publish(metric, List.of(), false, startedAt);
        }
        TheoreticalPnLSettings settings = settingsService.getSettings();
        log.info("Recalculating {} for {} positions", metric.getDisplayName(), snapshot.size());

        List<Position> remaining = snapshot;
        List<CompletableFuture<CalculationOutcome<?>>> futures = new ArrayList<>();

        if (metric.isLocalFallbackAvailable() && properties.isProbeEnabled()) {
            Position probe = snapshot.get(0);
            remaining = snapshot.subList(1, snapshot.size());
            transition(probe.getId(), metric, CalculationState.REQUESTING);
            try {
                Object value = callRemote(probe, metric, settings, false);
                futures.add(CompletableFuture.<CalculationOutcome<?>>completedFuture(succeeded(probe, metric, value, 1)));
            } catch (PricingServiceException e) {
                if (e.isFallbackEligible()) {
                    log.warn(
                            "{} probe for {} failed with status {}; calculating all {} positions locally",
                            metric.getDisplayName(),
                            probe.getId(),
                            e.getStatusCode(),
                            snapshot.size());
                    List<CalculationOutcome<?>> outcomes = new ArrayList<>();
                    for (Position position : snapshot) {
                        outcomes.add(fallback(position, metric, settings, position == probe ? 1 : 0, e));
                    }
                    return apply(metric, outcomes, true, startedAt);
                }
                log.debug("{} probe for {} failed with retryable status {}", metric, probe.getId(), e.getStatusCode());
                futures.add(submit(probe, metric, settings, 1, e.getMessage()));
            } catch (RuntimeException e) {
                log.debug("{} probe for {} failed: {}", metric, probe.getId(), e.getMessage());
                futures.add(submit(probe, metric, settings, 1, e.getMessage()));
            }
        }

        for (Position position : remaining) {
            futures.add(submit(position, metric, settings, 0, null));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<CalculationOutcome<?>> outcomes = new ArrayList<>();
        for (CompletableFuture<CalculationOutcome<?>> future : futures) {
            outcomes.add(future.join());
        }
        return apply(metric, outcomes, false, startedAt);
    }

    /**
     * Recalculates one metric for one position on the calling thread.
     *
     * @throws com.optiontracker.exception.ResourceNotFoundException if the position does not exist
     */
    public CalculationOutcome<?> recalculate(String positionId, CalculationMetric metric) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        Position position = positionBook.getById(positionId);
        CalculationOutcome<?> outcome = runStateMachine(position, metric, settingsService.getSettings(), 0, null);
        apply(metric, List.of(outcome), false, startedAt);
        return outcome;
    }

    /**
     * Theoretical P&L for the whole book through the bulk endpoint.
     *
     * <p>The bulk call is made once, without retries. Positions missing from its response
     * go through the per-position state machine. If the bulk call itself fails the batch
     * degrades to {@link #recalculateAll(CalculationMetric)}.
     */
    public BatchCalculationResult recalculateTheoreticalBulk() {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        List<Position> snapshot = positionBook.findAll();
        if (snapshot.isEmpty()) {
            return publish(CalculationMetric.THEORETICAL_PNL, List.of(), false, startedAt);
        }
        TheoreticalPnLSettings settings = settingsService.getSettings();
        List<String> ids = snapshot.stream().map(Position::getId).toList();

        Map<String, PnLResult> results;
        try {
            results = pricingServiceClient.getBulkTheoreticalPnL(ids, settings, false);
        } catch (PricingServiceException e) {
            log.warn(
                    "Bulk theoretical P&L failed with status {}, calculating per position: {}",
                    e.getStatusCode(),
                    e.getMessage());
            return recalculateAll(CalculationMetric.THEORETICAL_PNL);
        }

        List<CalculationOutcome<?>> outcomes = new ArrayList<>();
        List<CompletableFuture<CalculationOutcome<?>>> futures = new ArrayList<>();
        for (Position position : snapshot) {
            PnLResult result = results.get(position.getId());
            if (result != null) {
                outcomes.add(succeeded(position, CalculationMetric.THEORETICAL_PNL, result, 1));
            } else {
                futures.add(submit(position, CalculationMetric.THEORETICAL_PNL, settings, 0, null));
            }
        }
        if (!futures.isEmpty()) {
            log.info("Bulk theoretical P&L omitted {} positions, requesting them individually", futures.size());
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<CalculationOutcome<?>> future : futures) {
                outcomes.add(future.join());
            }
        }
        return apply(CalculationMetric.THEORETICAL_PNL, outcomes, false, startedAt);
    }

    private CompletableFuture<CalculationOutcome<?>> submit(
            Position position,
            CalculationMetric metric,
            TheoreticalPnLSettings settings,
            int attemptsMade,
            String lastError) {
        return CompletableFuture.<CalculationOutcome<?>>supplyAsync(
                        () -> runStateMachine(position, metric, settings, attemptsMade, lastError), calculationExecutor)
                .exceptionally(t -> {
                    log.error("Unexpected error calculating {} for {}", metric, position.getId(), t);
                    return failed(position, metric, attemptsMade, t.getMessage());
                });
    }

    // ========================
    // STATE MACHINE
    // ========================

    /**
     * Runs the retry loop starting after {@code attemptsMade} remote attempts.
     *
     * @param lastError failure message of the attempt already made, or null when starting fresh
     */
    private CalculationOutcome<?> runStateMachine(
            Position position,
            CalculationMetric metric,
            TheoreticalPnLSettings settings,
            int attemptsMade,
            String lastError) {
        int maxAttempts = properties.getMaxRetries() + 1;

        for (int attempt = attemptsMade + 1; attempt <= maxAttempts; attempt++) {
            boolean retry = attempt > 1;
            if (retry) {
                transition(position.getId(), metric, CalculationState.RETRYING);
                try {
                    retryDelayer.await(properties.getRetryDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return failed(position, metric, attempt - 1, "Interrupted while waiting to retry");
                }
            }
            transition(position.getId(), metric, CalculationState.REQUESTING);
            try {
                Object value = callRemote(position, metric, settings, retry);
                return succeeded(position, metric, value, attempt);
            } catch (PricingServiceException e) {
                if (metric.isLocalFallbackAvailable() && e.isFallbackEligible()) {
                    return fallback(position, metric, settings, attempt, e);
                }
                lastError = e.getMessage();
                log.warn(
                        "{} attempt {}/{} failed for {}: {}",
                        metric.getDisplayName(),
                        attempt,
                        maxAttempts,
                        position.getId(),
                        e.getMessage());
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn(
                        "{} attempt {}/{} failed for {} with unexpected error",
                        metric.getDisplayName(),
                        attempt,
                        maxAttempts,
                        position.getId(),
                        e);
            }
        }

        String message = "Failed to calculate " + metric.getDisplayName() + " after " + maxAttempts + " attempts"
                + (lastError != null ? ": " + lastError : "");
        log.error("{} for position {}", message, position.getId());
        return failed(position, metric, maxAttempts, message);
    }

    private Object callRemote(
            Position position, CalculationMetric metric, TheoreticalPnLSettings settings, boolean forceRecompute) {
        switch (metric) {
            case GREEKS:
                return pricingServiceClient.getGreeks(position);
            case PNL:
                return pricingServiceClient.getPnL(position.getId(), forceRecompute);
            case THEORETICAL_PNL:
                return pricingServiceClient.getTheoreticalPnL(position.getId(), settings, forceRecompute);
            default:
                throw new IllegalArgumentException("Unsupported metric: " + metric);
        }
    }

    // ========================
    // OUTCOMES
    // ========================

    private CalculationOutcome<?> succeeded(Position position, CalculationMetric metric, Object value, int attempts) {
        transition(position.getId(), metric, CalculationState.SUCCEEDED);
        Object stored = value instanceof PnLResult pnl
                ? pnl.toBuilder().error(null).clientCalculated(false).build()
                : value;
        return CalculationOutcome.builder()
                .positionId(position.getId())
                .metric(metric)
                .state(CalculationState.SUCCEEDED)
                .value(stored)
                .attempts(attempts)
                .build();
    }

    private CalculationOutcome<?> fallback(
            Position position,
            CalculationMetric metric,
            TheoreticalPnLSettings settings,
            int attempts,
            PricingServiceException cause) {
        transition(position.getId(), metric, CalculationState.FALLBACK);
        log.warn(
                "{} for {} calculated locally (pricing service status {})",
                metric.getDisplayName(),
                position.getId(),
                cause.getStatusCode());
        PnLResult result = computeLocally(position, metric, settings);
        return CalculationOutcome.builder()
                .positionId(position.getId())
                .metric(metric)
                .state(CalculationState.FALLBACK)
                .value(result)
                .error(result.getError())
                .attempts(attempts)
                .build();
    }

    private CalculationOutcome<?> failed(Position position, CalculationMetric metric, int attempts, String error) {
        transition(position.getId(), metric, CalculationState.FAILED);
        Object value = metric == CalculationMetric.GREEKS
                ? null
                : PnLResult.failed(position.getId(), error, false, LocalDateTime.now(clock));
        return CalculationOutcome.builder()
                .positionId(position.getId())
                .metric(metric)
                .state(CalculationState.FAILED)
                .value(value)
                .error(error)
                .attempts(attempts)
                .build();
    }

    /** Local approximation. Missing premium or mark price gives a zeroed, error-flagged result. */
    private PnLResult computeLocally(Position position, CalculationMetric metric, TheoreticalPnLSettings settings) {
        if (position.getPremium() == null || position.getMarkPrice() == null) {
            String missing = position.getPremium() == null ? "premium" : "mark price";
            return PnLResult.failed(
                    position.getId(),
                    "Insufficient data for local " + metric.getDisplayName() + ": no " + missing,
                    true,
                    LocalDateTime.now(clock));
        }
        BigDecimal markPrice = position.getMarkPrice();
        if (metric == CalculationMetric.THEORETICAL_PNL) {
            markPrice = localPnLCalculator.computeTheoreticalMarkPrice(
                    markPrice, position.getType(), settings.getPriceChangePercent());
        }
        PnLBreakdown breakdown = localPnLCalculator.computePnL(
                position.getQuantity(), position.getPremium(), markPrice, position.getAction());
        return PnLResult.builder()
                .positionId(position.getId())
                .pnlAmount(breakdown.getPnlAmount())
                .pnlPercent(breakdown.getPnlPercent())
                .initialValue(breakdown.getInitialValue())
                .currentValue(breakdown.getCurrentValue())
                .calculationTimestamp(LocalDateTime.now(clock))
                .clientCalculated(true)
                .build();
    }

    // ========================
    // PUBLISHING
    // ========================

    /**
     * Writes every outcome into the position book in one swap, then publishes the batch.
     */
    private BatchCalculationResult apply(
            CalculationMetric metric, List<CalculationOutcome<?>> outcomes, boolean shortCircuited, LocalDateTime startedAt) {
        Map<String, CalculationOutcome<?>> byId = new HashMap<>();
        for (CalculationOutcome<?> outcome : outcomes) {
            byId.put(outcome.getPositionId(), outcome);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        positionBook.updateAll(position -> {
            CalculationOutcome<?> outcome = byId.get(position.getId());
            return outcome != null ? withOutcome(position, outcome, now) : position;
        });
        // positions removed while their calculation was in flight
        for (String positionId : byId.keySet()) {
            if (positionBook.findById(positionId).isEmpty()) {
                forget(positionId);
            }
        }
        return publish(metric, outcomes, shortCircuited, startedAt);
    }

    private BatchCalculationResult publish(
            CalculationMetric metric, List<CalculationOutcome<?>> outcomes, boolean shortCircuited, LocalDateTime startedAt) {
        BatchCalculationResult result = BatchCalculationResult.builder()
                .metric(metric)
                .outcomes(List.copyOf(outcomes))
                .probeShortCircuited(shortCircuited)
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now(clock))
                .build();
        eventPublisher.publishEvent(new CalculationCompletedEvent(this, result));
        return result;
    }

    private static Position withOutcome(Position position, CalculationOutcome<?> outcome, LocalDateTime now) {
        Position.PositionBuilder builder = position.toBuilder().lastUpdated(now);
        switch (outcome.getMetric()) {
            case GREEKS:
                builder.greeks((Greeks) outcome.getValue()).greeksError(outcome.isFailed() ? outcome.getError() : null);
                break;
            case PNL:
                builder.pnl((PnLResult) outcome.getValue());
                break;
            case THEORETICAL_PNL:
                builder.theoreticalPnl((PnLResult) outcome.getValue());
                break;
            default:
                break;
        }
        return builder.build();
    }

    private void transition(String positionId, CalculationMetric metric, CalculationState state) {
        CalculationState previous = states.put(stateKey(positionId, metric), state);
        log.debug("{} {}: {} -> {}", positionId, metric, previous != null ? previous : CalculationState.IDLE, state);
    }

    private void forget(String positionId) {
        for (CalculationMetric metric : CalculationMetric.values()) {
            states.remove(stateKey(positionId, metric));
        }
        log.debug("Calculation states of {} dropped", positionId);
    }

    private static String stateKey(String positionId, CalculationMetric metric) {
        return positionId + ":" + metric.name();
    }
}

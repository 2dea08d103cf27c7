package com.optiontracker.position;

import com.optiontracker.calculation.MarkPriceDeriver;
import com.optiontracker.domain.enums.PositionAction;
import com.optiontracker.domain.model.Position;
import com.optiontracker.event.PositionRemovedEvent;
import com.optiontracker.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Owner of the user's position list.
 *
 * <p>The list is an immutable snapshot held in an {@link AtomicReference}; every mutation
 * builds a new list and swaps it in. Readers never observe a partially updated list, and a
 * batch recalculation publishes all of its results in one {@link #updateAll} call.
 *
 * <p>Mark price has two writers. Automatic updates ({@link #applyQuote},
 * {@link #applyMarkPrice}) are ignored while the position carries a manual override;
 * {@link #overrideMarkPrice} always wins and sets the override until
 * {@link #clearMarkPriceOverride} is called.
 *
 * <p>Removals are announced with a {@link PositionRemovedEvent}.
 */
@Component
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    private final AtomicReference<List<Position>> positions = new AtomicReference<>(List.of());
    private final MarkPriceDeriver markPriceDeriver;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PositionBook(MarkPriceDeriver markPriceDeriver, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.markPriceDeriver = markPriceDeriver;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public List<Position> findAll() {
        return positions.get();
    }

    public Optional<Position> findById(String positionId) {
        return positions.get().stream()
                .filter(p -> p.getId().equals(positionId))
                .findFirst();
    }

    public Position getById(String positionId) {
        return findById(positionId).orElseThrow(() -> ResourceNotFoundException.position(positionId));
    }

    /**
     * Adds a position. A negative quantity is read as a short: the action becomes SELL and
     * the quantity its magnitude. An id is generated when none is given.
     */
    public Position add(Position position) {
        Position.PositionBuilder builder = position.toBuilder();
        if (position.getQuantity() < 0) {
            builder.action(PositionAction.SELL).quantity(Math.abs(position.getQuantity()));
        }
        if (position.getId() == null || position.getId().isBlank()) {
            builder.id(UUID.randomUUID().toString());
        }
        Position added = builder.lastUpdated(LocalDateTime.now(clock)).build();

        positions.updateAndGet(current -> {
            List<Position> next = new ArrayList<>(current);
            next.add(added);
            return List.copyOf(next);
        });
        log.info(
                "Position added: {} {} {}x {} {} {}",
                added.getId(),
                added.getAction(),
                added.getQuantity(),
                added.getTicker(),
                added.getStrike(),
                added.getType());
        return added;
    }

    public void remove(String positionId) {
        List<Position> before = positions.getAndUpdate(current -> current.stream()
                .filter(p -> !p.getId().equals(positionId))
                .toList());
        if (before.stream().noneMatch(p -> p.getId().equals(positionId))) {
            throw ResourceNotFoundException.position(positionId);
        }
        log.info("Position removed: {}", positionId);
        eventPublisher.publishEvent(new PositionRemovedEvent(this, positionId));
    }

    /**
     * Derives a mark price from a quote and applies it unless the position is overridden.
     * An underivable quote (no usable side) leaves the mark price unchanged.
     */
    public Position applyQuote(String positionId, BigDecimal bid, BigDecimal ask) {
        BigDecimal mark = markPriceDeriver.derive(bid, ask);
        if (mark == null) {
            log.debug("Quote for {} gives no mark price (bid={}, ask={})", positionId, bid, ask);
            return getById(positionId);
        }
        return applyMarkPrice(positionId, mark);
    }

    /** Automatic mark price update. No-op while a manual override is active. */
    public Position applyMarkPrice(String positionId, BigDecimal markPrice) {
        return update(positionId, p -> {
            if (p.isMarkPriceOverride()) {
                log.debug("Mark price update for {} suppressed by manual override", positionId);
                return p;
            }
            return p.toBuilder()
                    .markPrice(markPrice)
                    .lastUpdated(LocalDateTime.now(clock))
                    .build();
        });
    }

    /** Manual mark price. Sets the override so automatic updates stop. */
    public Position overrideMarkPrice(String positionId, BigDecimal markPrice) {
        log.info("Mark price of {} overridden to {}", positionId, markPrice);
        return update(positionId, p -> p.toBuilder()
                .markPrice(markPrice)
                .markPriceOverride(true)
                .lastUpdated(LocalDateTime.now(clock))
                .build());
    }

    /** Re-enables automatic mark price updates. The current mark price is kept. */
    public Position clearMarkPriceOverride(String positionId) {
        return update(positionId, p -> p.toBuilder()
                .markPriceOverride(false)
                .lastUpdated(LocalDateTime.now(clock))
                .build());
    }

    /**
     * Atomically applies {@code updater} to every position. Positions added or removed
     * while the updater's inputs were being computed are preserved as-is.
     */
    public void updateAll(UnaryOperator<Position> updater) {
        positions.updateAndGet(current -> current.stream().map(updater).toList());
    }

    private Position update(String positionId, UnaryOperator<Position> updater) {
        getById(positionId);
        List<Position> next = positions.updateAndGet(current -> current.stream()
                .map(p -> p.getId().equals(positionId) ? updater.apply(p) : p)
                .toList());
        return next.stream()
                .filter(p -> p.getId().equals(positionId))
                .findFirst()
                .orElseThrow(() -> ResourceNotFoundException.position(positionId));
    }
}

package com.optiontracker.domain.model;

import com.optiontracker.domain.enums.OptionType;
import com.optiontracker.domain.enums.PositionAction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single option leg held by the user.
 *
 * <p>Quantity is an unsigned magnitude; {@link #getAction()} is the one authoritative
 * direction. The signed quantity is derived where needed and never stored.
 *
 * <p>Positions held by {@link com.optiontracker.position.PositionBook} are treated as
 * immutable snapshots: updates go through {@code toBuilder()} and a whole-list replacement.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String ticker;
    private LocalDate expiration;
    private BigDecimal strike;
    private OptionType type;
    private PositionAction action;

    /** Number of contracts, always positive. */
    private int quantity;

    /** Entry price per share. Optional: local P&L cannot be computed without it. */
    private BigDecimal premium;

    /** Current reference price per share. Optional. */
    private BigDecimal markPrice;

    /** True once the user edited the mark price; automatic updates are ignored until cleared. */
    private boolean markPriceOverride;

    /** Sign/quantity-adjusted Greeks from the pricing service. */
    private Greeks greeks;

    /** Why the last Greeks calculation failed. Null when Greeks are current or never requested. */
    private String greeksError;

    private PnLResult pnl;
    private PnLResult theoreticalPnl;

    private LocalDateTime lastUpdated;

    /** Derived from action: positive for BUY, negative for SELL. */
    public int getSignedQuantity() {
        return action == PositionAction.SELL ? -quantity : quantity;
    }
}

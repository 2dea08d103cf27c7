package com.optiontracker.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current or theoretical P&L of a single position (or of a group, when produced by
 * the aggregator).
 *
 * <p>A result carrying an {@code error} is still structurally valid: its magnitudes are
 * zero and consumers render it as neutral, distinguishable from a trustworthy zero by
 * the flag. {@code clientCalculated} marks results produced by the local approximation
 * instead of the pricing service.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PnLResult {

    private String positionId;

    /** Signed profit/loss in currency. */
    private BigDecimal pnlAmount;

    /** Signed profit/loss relative to the cost basis, in percent. */
    private BigDecimal pnlPercent;

    /** Cost basis magnitude (premium x quantity x multiplier). */
    private BigDecimal initialValue;

    /** Current value magnitude (mark x quantity x multiplier). */
    private BigDecimal currentValue;

    private BigDecimal impliedVolatility;
    private BigDecimal underlyingPrice;
    private LocalDateTime calculationTimestamp;

    /** Reason the calculation did not produce trustworthy figures. Null on success. */
    private String error;

    private boolean clientCalculated;

    /**
     * An error-flagged result with all magnitudes zeroed.
     */
    public static PnLResult failed(
            String positionId, String error, boolean clientCalculated, LocalDateTime calculationTimestamp) {
        return PnLResult.builder()
                .positionId(positionId)
                .pnlAmount(BigDecimal.ZERO)
                .pnlPercent(BigDecimal.ZERO)
                .initialValue(BigDecimal.ZERO)
                .currentValue(BigDecimal.ZERO)
                .calculationTimestamp(calculationTimestamp)
                .error(error)
                .clientCalculated(clientCalculated)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }
}

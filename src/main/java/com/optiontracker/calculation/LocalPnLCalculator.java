package com.optiontracker.calculation;

import com.optiontracker.domain.enums.OptionType;
import com.optiontracker.domain.enums.PositionAction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Approximates P&L without the pricing service. Used as the fallback when the service
 * does not implement a P&L capability or cannot be reached.
 *
 * <p>Formulas (multiplier = 100 shares per contract):
 * <ul>
 *   <li>initialValue = |quantity| * premium * 100</li>
 *   <li>currentValue = |quantity| * markPrice * 100</li>
 *   <li>BUY: pnl = currentValue - initialValue</li>
 *   <li>SELL: pnl = initialValue - currentValue (premium received is the profit; a rising
 *       option price is a loss)</li>
 *   <li>pnlPercent = pnl / initialValue * 100, or 0 when initialValue is 0</li>
 * </ul>
 *
 * <p>The theoretical mark price is a linear proxy: calls move with the underlying, puts
 * against it, with no volatility or time-decay term. Anything more accurate belongs to the
 * pricing service.
 */
@Component
public class LocalPnLCalculator {

    public static final BigDecimal CONTRACT_MULTIPLIER = BigDecimal.valueOf(100);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Computes P&L for a position at the given mark price.
     *
     * @param quantity  contracts; only the magnitude is used
     * @param premium   entry price per share, not null
     * @param markPrice current price per share, not null
     * @param action    BUY or SELL
     */
    public PnLBreakdown computePnL(int quantity, BigDecimal premium, BigDecimal markPrice, PositionAction action) {
        BigDecimal contracts = BigDecimal.valueOf(Math.abs((long) quantity));
        BigDecimal initialValue = contracts.multiply(premium).multiply(CONTRACT_MULTIPLIER);
        BigDecimal currentValue = contracts.multiply(markPrice).multiply(CONTRACT_MULTIPLIER);

        BigDecimal pnlAmount =
                action == PositionAction.BUY ? currentValue.subtract(initialValue) : initialValue.subtract(currentValue);

        BigDecimal pnlPercent = initialValue.signum() > 0
                ? pnlAmount.multiply(HUNDRED).divide(initialValue, 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(2);

        return new PnLBreakdown(
                pnlAmount.setScale(2, RoundingMode.HALF_UP),
                pnlPercent,
                initialValue.setScale(2, RoundingMode.HALF_UP),
                currentValue.setScale(2, RoundingMode.HALF_UP));
    }

    /**
     * Projects the mark price for an underlying move of {@code priceChangePercent}.
     * Call: mark * m, put: mark * (2 - m), where m = 1 + pct/100. Never negative.
     */
    public BigDecimal computeTheoreticalMarkPrice(BigDecimal markPrice, OptionType type, BigDecimal priceChangePercent) {
        BigDecimal change = priceChangePercent != null ? priceChangePercent : BigDecimal.ZERO;
        BigDecimal multiplier = BigDecimal.ONE.add(change.divide(HUNDRED));

        BigDecimal theoretical =
                type == OptionType.CALL ? markPrice.multiply(multiplier) : markPrice.multiply(TWO.subtract(multiplier));

        return theoretical.signum() < 0 ? BigDecimal.ZERO : theoretical;
    }
}

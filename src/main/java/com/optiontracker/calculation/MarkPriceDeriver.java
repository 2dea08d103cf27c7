package com.optiontracker.calculation;

import com.optiontracker.domain.model.OptionContract;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Derives a tradable reference price from bid/ask quotes.
 *
 * <p>A null result means "unknown". Callers must keep the previous mark price (or leave it
 * empty) rather than treat null as zero.
 */
@Component
public class MarkPriceDeriver {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Midpoint of bid and ask, or the one side that is quoted.
     *
     * @return the mark price, or null if no side is quoted or either side is negative
     */
    public BigDecimal derive(BigDecimal bid, BigDecimal ask) {
        if (isNegative(bid) || isNegative(ask)) {
            return null;
        }
        if (bid != null && ask != null) {
            return bid.add(ask).divide(TWO, Math.max(bid.scale(), ask.scale()) + 1, RoundingMode.HALF_UP);
        }
        if (bid != null) {
            return bid;
        }
        return ask;
    }

    /**
     * Same as {@link #derive(BigDecimal, BigDecimal)} for raw doubles. NaN or infinite
     * quotes make the result unknown.
     */
    public BigDecimal derive(Double bid, Double ask) {
        if (isInvalid(bid) || isInvalid(ask)) {
            return null;
        }
        return derive(
                bid != null ? BigDecimal.valueOf(bid) : null,
                ask != null ? BigDecimal.valueOf(ask) : null);
    }

    /** Mark price of a chain contract, from its bid/ask. */
    public BigDecimal derive(OptionContract contract) {
        if (contract == null) {
            return null;
        }
        return derive(contract.getBid(), contract.getAsk());
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    private static boolean isInvalid(Double value) {
        return value != null && (value.isNaN() || value.isInfinite());
    }
}

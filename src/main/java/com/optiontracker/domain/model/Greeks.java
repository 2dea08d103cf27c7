package com.optiontracker.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Option Greeks for a position, as returned by the pricing service.
 *
 * <p>Values are already adjusted for the position's action and quantity (a short
 * 2-lot call carries a negative, doubled delta). The engine never re-scales them;
 * aggregation is a plain sum across positions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Greeks {

    /** Price sensitivity to underlying movement. */
    private BigDecimal delta;

    /** Rate of change of delta. Highest for ATM options. */
    private BigDecimal gamma;

    /** Time decay per day. Negative for long options. */
    private BigDecimal theta;

    /** Sensitivity to a 1% change in implied volatility. */
    private BigDecimal vega;

    /** Sensitivity to interest rate changes. */
    private BigDecimal rho;

    public static final Greeks ZERO = Greeks.builder()
            .delta(BigDecimal.ZERO)
            .gamma(BigDecimal.ZERO)
            .theta(BigDecimal.ZERO)
            .vega(BigDecimal.ZERO)
            .rho(BigDecimal.ZERO)
            .build();

    /**
     * Component-wise sum. Missing components are treated as zero.
     */
    public Greeks plus(Greeks other) {
        return Greeks.builder()
                .delta(add(delta, other.delta))
                .gamma(add(gamma, other.gamma))
                .theta(add(theta, other.theta))
                .vega(add(vega, other.vega))
                .rho(add(rho, other.rho))
                .build();
    }

    private static BigDecimal add(BigDecimal left, BigDecimal right) {
        BigDecimal l = left != null ? left : BigDecimal.ZERO;
        BigDecimal r = right != null ? right : BigDecimal.ZERO;
        return l.add(r);
    }
}

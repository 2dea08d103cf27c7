package com.optiontracker.domain.model;

import com.optiontracker.domain.enums.OptionTypeFilter;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Restrictions for an option chain lookup.
 *
 * <p>Option type and strike bounds are sent to the pricing service and are part of the
 * cache key. Implied volatility bounds are applied locally to the cached chain, so
 * changing them never costs a remote call.
 */
@Value
@Builder(toBuilder = true)
public class OptionChainFilter {

    @Builder.Default
    OptionTypeFilter optionType = OptionTypeFilter.ALL;

    BigDecimal minStrike;
    BigDecimal maxStrike;
    BigDecimal minImpliedVolatility;
    BigDecimal maxImpliedVolatility;

    public static OptionChainFilter none() {
        return OptionChainFilter.builder().build();
    }

    /** True if the contract passes the implied volatility bounds. Contracts without IV only pass unbounded filters. */
    public boolean acceptsImpliedVolatility(OptionContract contract) {
        if (minImpliedVolatility == null && maxImpliedVolatility == null) {
            return true;
        }
        BigDecimal iv = contract.getImpliedVolatility();
        if (iv == null) {
            return false;
        }
        if (minImpliedVolatility != null && iv.compareTo(minImpliedVolatility) < 0) {
            return false;
        }
        return maxImpliedVolatility == null || iv.compareTo(maxImpliedVolatility) <= 0;
    }
}

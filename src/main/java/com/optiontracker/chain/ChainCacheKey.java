package com.optiontracker.chain;

import com.optiontracker.domain.enums.OptionTypeFilter;
import com.optiontracker.domain.model.OptionChainFilter;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Cache keys for chain data.
 *
 * <pre>
 *   option_chain:AAPL:2025-01-17:type=call:min=150:max=200
 *   expirations:AAPL
 * </pre>
 *
 * Only the parts of the filter that change the remote request are encoded, in a fixed
 * order and with strikes normalized ({@code 150.00} and {@code 150} are the same key).
 * Implied volatility bounds are applied after retrieval and do not appear.
 */
public final class ChainCacheKey {

    static final String CHAIN_PREFIX = "option_chain:";
    static final String EXPIRATIONS_PREFIX = "expirations:";

    private ChainCacheKey() {}

    public static String optionChain(String ticker, LocalDate expiration, OptionChainFilter filter) {
        OptionTypeFilter type = filter.getOptionType() != null ? filter.getOptionType() : OptionTypeFilter.ALL;
        return CHAIN_PREFIX + normalizeTicker(ticker) + ":" + expiration
                + ":type=" + type.name().toLowerCase(Locale.ROOT)
                + ":min=" + strike(filter.getMinStrike())
                + ":max=" + strike(filter.getMaxStrike());
    }

    public static String expirations(String ticker) {
        return EXPIRATIONS_PREFIX + normalizeTicker(ticker);
    }

    public static String normalizeTicker(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    /** True if the key caches data for the (normalized) ticker. */
    static boolean belongsTo(String key, String normalizedTicker) {
        return key.equals(EXPIRATIONS_PREFIX + normalizedTicker)
                || key.startsWith(CHAIN_PREFIX + normalizedTicker + ":");
    }

    private static String strike(BigDecimal value) {
        return value != null ? value.stripTrailingZeros().toPlainString() : "*";
    }
}

package com.optiontracker.chain;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.optiontracker.calculation.MarkPriceDeriver;
import com.optiontracker.calendar.MarketSessionService;
import com.optiontracker.domain.model.OptionChainFilter;
import com.optiontracker.domain.model.OptionContract;
import com.optiontracker.domain.model.OptionExpiration;
import com.optiontracker.exception.BusinessException;
import com.optiontracker.pricing.PricingServiceClient;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Option chain and expiration lookups for the contract selection flow, served through
 * the {@link ChainDataCache}.
 *
 * <p>The TTL of each fetched entry is chosen from the market session at fetch time: short
 * while the regular session runs, longer overnight and on weekends. Chain failures are
 * not cached and propagate to the caller as
 * {@link com.optiontracker.exception.PricingServiceException}.
 */
@Service
public class OptionChainService {

    private static final Logger log = LoggerFactory.getLogger(OptionChainService.class);

    private final PricingServiceClient pricingServiceClient;
    private final ChainDataCache chainDataCache;
    private final MarketSessionService marketSessionService;
    private final MarkPriceDeriver markPriceDeriver;

    public OptionChainService(
            PricingServiceClient pricingServiceClient,
            ChainDataCache chainDataCache,
            MarketSessionService marketSessionService,
            MarkPriceDeriver markPriceDeriver) {
        this.pricingServiceClient = pricingServiceClient;
        this.chainDataCache = chainDataCache;
        this.marketSessionService = marketSessionService;
        this.markPriceDeriver = markPriceDeriver;
    }

    public List<OptionExpiration> getExpirations(String ticker) {
        String symbol = requireTicker(ticker);
        Duration ttl = marketSessionService.currentCacheTtl();
        return chainDataCache.getOrFetch(
                ChainCacheKey.expirations(symbol), () -> pricingServiceClient.getExpirations(symbol), ttl);
    }

    /**
     * Contracts for one expiration. Type and strike bounds are part of the remote request
     * and the cache key; implied volatility bounds filter the cached chain locally.
     */
    public List<OptionContract> getOptionChain(String ticker, LocalDate expiration, OptionChainFilter filter) {
        String symbol = requireTicker(ticker);
        if (expiration == null) {
            throw new BusinessException("Expiration is required");
        }
        OptionChainFilter effective = filter != null ? filter : OptionChainFilter.none();
        validateStrikes(effective);

        Duration ttl = marketSessionService.currentCacheTtl();
        List<OptionContract> chain = chainDataCache.getOrFetch(
                ChainCacheKey.optionChain(symbol, expiration, effective),
                () -> pricingServiceClient.getOptionChain(symbol, expiration, effective),
                ttl);

        List<OptionContract> filtered = chain.stream()
                .filter(effective::acceptsImpliedVolatility)
                .toList();
        log.debug("Chain {} {}: {} contracts, {} after IV filter", symbol, expiration, chain.size(), filtered.size());
        return filtered;
    }

    /** Mark price for a contract chosen from the chain, or null when it has no usable quote. */
    public BigDecimal markPriceFor(OptionContract contract) {
        return markPriceDeriver.derive(contract);
    }

    /** Clears cached chains and expirations for the ticker, or everything when ticker is null. */
    public void clearCache(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            chainDataCache.invalidateAll();
        } else {
            chainDataCache.invalidateTicker(ticker);
        }
    }

    public CacheStats cacheStats() {
        return chainDataCache.stats();
    }

    public long cacheSize() {
        return chainDataCache.size();
    }

    /**
     * Parses an expiration as sent by clients: {@code yyyy-MM-dd}, or a full ISO timestamp
     * whose time part is dropped.
     */
    public static LocalDate parseExpiration(String expiration) {
        if (expiration == null || expiration.isBlank()) {
            throw new BusinessException("Expiration is required");
        }
        String value = expiration.trim();
        int timeSeparator = value.indexOf('T');
        String datePart = timeSeparator > 0 ? value.substring(0, timeSeparator) : value;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            throw new BusinessException("Invalid expiration date: " + expiration);
        }
    }

    private static String requireTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new BusinessException("Ticker is required");
        }
        return ChainCacheKey.normalizeTicker(ticker);
    }

    private static void validateStrikes(OptionChainFilter filter) {
        if (filter.getMinStrike() != null
                && filter.getMaxStrike() != null
                && filter.getMinStrike().compareTo(filter.getMaxStrike()) > 0) {
            throw new BusinessException(
                    "minStrike " + filter.getMinStrike() + " is greater than maxStrike " + filter.getMaxStrike());
        }
    }
}

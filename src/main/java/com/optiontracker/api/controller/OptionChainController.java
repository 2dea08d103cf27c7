package com.optiontracker.api.controller;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.optiontracker.api.dto.response.CacheStatsResponse;
import com.optiontracker.api.dto.response.OptionChainEntryResponse;
import com.optiontracker.chain.OptionChainService;
import com.optiontracker.domain.enums.OptionTypeFilter;
import com.optiontracker.domain.model.OptionChainFilter;
import com.optiontracker.domain.model.OptionContract;
import com.optiontracker.domain.model.OptionExpiration;
import com.optiontracker.mapper.ApiDtoMapper;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cached option chain and expiration lookups for contract selection.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/option-chains/{ticker}/expirations</li>
 *   <li>GET /api/option-chains/{ticker}/{expiration}?optionType=&minStrike=&maxStrike=&minIv=&maxIv=</li>
 *   <li>DELETE /api/option-chains/cache?ticker= -- clear one ticker, or everything</li>
 *   <li>GET /api/option-chains/cache/stats</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/option-chains")
public class OptionChainController {

    private final OptionChainService optionChainService;
    private final ApiDtoMapper apiDtoMapper;

    public OptionChainController(OptionChainService optionChainService, ApiDtoMapper apiDtoMapper) {
        this.optionChainService = optionChainService;
        this.apiDtoMapper = apiDtoMapper;
    }

    @GetMapping("/{ticker}/expirations")
    public List<OptionExpiration> getExpirations(@PathVariable String ticker) {
        return optionChainService.getExpirations(ticker);
    }

    /**
     * @param expiration yyyy-MM-dd; a full ISO timestamp is accepted and truncated to its date
     */
    @GetMapping("/{ticker}/{expiration}")
    public List<OptionChainEntryResponse> getOptionChain(
            @PathVariable String ticker,
            @PathVariable String expiration,
            @RequestParam(defaultValue = "ALL") OptionTypeFilter optionType,
            @RequestParam(required = false) BigDecimal minStrike,
            @RequestParam(required = false) BigDecimal maxStrike,
            @RequestParam(required = false) BigDecimal minIv,
            @RequestParam(required = false) BigDecimal maxIv) {
        LocalDate expirationDate = OptionChainService.parseExpiration(expiration);
        OptionChainFilter filter = OptionChainFilter.builder()
                .optionType(optionType)
                .minStrike(minStrike)
                .maxStrike(maxStrike)
                .minImpliedVolatility(minIv)
                .maxImpliedVolatility(maxIv)
                .build();

        List<OptionContract> contracts = optionChainService.getOptionChain(ticker, expirationDate, filter);
        return contracts.stream()
                .map(contract -> {
                    OptionChainEntryResponse entry = apiDtoMapper.toResponse(contract);
                    entry.setMarkPrice(optionChainService.markPriceFor(contract));
                    return entry;
                })
                .toList();
    }

    @DeleteMapping("/cache")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearCache(@RequestParam(required = false) String ticker) {
        optionChainService.clearCache(ticker);
    }

    @GetMapping("/cache/stats")
    public CacheStatsResponse getCacheStats() {
        CacheStats stats = optionChainService.cacheStats();
        return CacheStatsResponse.builder()
                .size(optionChainService.cacheSize())
                .hitCount(stats.hitCount())
                .missCount(stats.missCount())
                .hitRate(stats.hitRate())
                .loadSuccessCount(stats.loadSuccessCount())
                .loadFailureCount(stats.loadFailureCount())
                .evictionCount(stats.evictionCount())
                .build();
    }
}

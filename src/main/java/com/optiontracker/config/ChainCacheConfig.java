package com.optiontracker.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.optiontracker.chain.ChainDataCache;
import java.util.concurrent.ForkJoinPool;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Option chain cache sizing, bound to {@code option-tracker.chain-cache.*}. Entry TTLs
 * come from {@link com.optiontracker.calendar.MarketSessionService}, not from here.
 */
@Configuration
@ConfigurationProperties(prefix = "option-tracker.chain-cache")
@Getter
@Setter
public class ChainCacheConfig {

    private long maximumSize = 500;

    @Bean
    public ChainDataCache chainDataCache() {
        return new ChainDataCache(Ticker.systemTicker(), ForkJoinPool.commonPool(), maximumSize);
    }
}

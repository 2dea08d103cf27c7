package com.optiontracker.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning of the calculation orchestrator, bound to {@code option-tracker.calculation.*}.
 */
@Component
@ConfigurationProperties(prefix = "option-tracker.calculation")
@Getter
@Setter
public class CalculationProperties {

    /** Retries after the first failed attempt. 3 means at most 4 remote calls per position. */
    private int maxRetries = 3;

    /** Fixed pause before each retry. */
    private Duration retryDelay = Duration.ofSeconds(1);

    /** Send one representative P&L request before a batch to detect an unavailable capability. */
    private boolean probeEnabled = true;

    private int corePoolSize = 4;

    private int maxPoolSize = 8;

    private int queueCapacity = 200;
}

package com.optiontracker.config;

import com.optiontracker.calculation.RetryDelayer;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for per-position calculations, plus the clock and retry delayer the engine
 * depends on so tests can replace them.
 */
@Configuration
public class AsyncConfig {

    private final CalculationProperties calculationProperties;

    public AsyncConfig(CalculationProperties calculationProperties) {
        this.calculationProperties = calculationProperties;
    }

    @Bean("calculationExecutor")
    public ThreadPoolTaskExecutor calculationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(calculationProperties.getCorePoolSize());
        executor.setMaxPoolSize(calculationProperties.getMaxPoolSize());
        executor.setQueueCapacity(calculationProperties.getQueueCapacity());
        executor.setThreadNamePrefix("calc-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public RetryDelayer retryDelayer() {
        return RetryDelayer.sleeping();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

package com.optiontracker.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Connection settings for the remote pricing service, bound to {@code pricing-service.*}.
 *
 * <p>The timeouts live on the request factory, so every call made through
 * {@link #pricingRestClient()} is bounded. A call that times out surfaces as a
 * {@link org.springframework.web.client.ResourceAccessException} and is classified as
 * "unreachable" by the client.
 */
@Configuration
@ConfigurationProperties(prefix = "pricing-service")
@Getter
@Setter
public class PricingServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(PricingServiceConfig.class);

    private String baseUrl = "http://localhost:8003";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);

    @Bean
    public RestClient pricingRestClient() {
        log.info("Pricing service at {} (connect timeout {}, read timeout {})", baseUrl, connectTimeout, readTimeout);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}

package com.rentnest.tm30.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JCircuitBreakerFactory;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JConfigBuilder;
import org.springframework.cloud.client.circuitbreaker.Customizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker and time limiter settings for the Feign clients.
 * Circuit breaker ids are derived from the Feign interface name, e.g. {@code PassportOcrClient#scan(OcrScanRequest)}.
 */
@Configuration
@RequiredArgsConstructor
public class ExternalCallResilienceConfig {

    private static final Duration TIME_LIMIT_MARGIN = Duration.ofSeconds(5);

    private final Tm30Properties properties;

    @Bean
    public Customizer<Resilience4JCircuitBreakerFactory> tm30CircuitBreakerCustomizer() {
        return factory -> factory.configureDefault(id -> new Resilience4JConfigBuilder(id)
                .circuitBreakerConfig(CircuitBreakerConfig.custom()
                        .slidingWindowSize(20)
                        .minimumNumberOfCalls(10)
                        .failureRateThreshold(50)
                        .waitDurationInOpenState(Duration.ofSeconds(30))
                        .permittedNumberOfCallsInHalfOpenState(5)
                        .automaticTransitionFromOpenToHalfOpenEnabled(true)
                        .build())
                .timeLimiterConfig(TimeLimiterConfig.custom()
                        .timeoutDuration(timeLimitFor(id))
                        .build())
                .build());
    }

    Duration timeLimitFor(String circuitBreakerId) {
        Duration readTimeout;
        if (circuitBreakerId.startsWith("PassportOcrClient")) {
            readTimeout = properties.getOcr().getReadTimeout();
        } else if (circuitBreakerId.startsWith("ImageStorageClient")) {
            readTimeout = properties.getStorage().getReadTimeout();
        } else {
            readTimeout = properties.getExecutor().getReadTimeout();
        }
        return readTimeout.plus(TIME_LIMIT_MARGIN);
    }
}

package com.products.scraper.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries and the policies applied to calls
 * against the captcha solving provider.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name shared by the retry and the circuit breaker guarding the provider. */
    public static final String CAPTCHA_SOLVER = "captchaSolver";

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    /**
     * Retries transient provider failures (connection problems, 5xx) three
     * times with a short exponential backoff.
     *
     * @param registry the global {@link RetryRegistry} to pull from
     * @return a {@link Retry} configured under the name "captchaSolver"
     */
    @Bean
    public Retry captchaRetry(final RetryRegistry registry) {
        RetryConfig cfg = RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2.0))
                .retryOnException(Resilience4jConfig::isTransient)
                .build();
        return registry.retry(CAPTCHA_SOLVER, cfg);
    }

    /**
     * Opens after half of the last ten provider calls failed, so an outage
     * at the provider does not add its timeouts to every scrape.
     *
     * @param registry the global {@link CircuitBreakerRegistry} to pull from
     * @return a {@link CircuitBreaker} configured under the name "captchaSolver"
     */
    @Bean
    public CircuitBreaker captchaCircuitBreaker(final CircuitBreakerRegistry registry) {
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .minimumNumberOfCalls(4)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build();
        return registry.circuitBreaker(CAPTCHA_SOLVER, cfg);
    }

    static boolean isTransient(final Throwable t) {
        if (t instanceof WebClientResponseException wcre) {
            return wcre.getStatusCode().is5xxServerError();
        }
        return t instanceof WebClientRequestException || t instanceof IOException;
    }
}

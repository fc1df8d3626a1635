package com.example.tenantsync.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.retry.event.RetryOnErrorEvent;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.github.resilience4j.retry.event.RetryOnSuccessEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

/**
 * Logs resilience4j retry and circuit breaker events for the wrapper API client.
 *
 * In-process retries here are short (a few hundred ms); long-range retry of a whole phase
 * is Temporal's activity retry policy.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RetryEventConfig {

    static final String WRAPPER_API = "wrapperApi";

    private final RetryRegistry retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @PostConstruct
    public void configureEventLogging() {
        retryRegistry.getAllRetries()
                .stream()
                .filter(retry -> retry.getName().equals(WRAPPER_API))
                .findFirst()
                .ifPresentOrElse(
                        retry -> retry.getEventPublisher()
                                .onRetry(this::logRetryAttempt)
                                .onSuccess(this::logRetrySuccess)
                                .onError(this::logRetryError),
                        () -> log.warn("Retry not found in registry, skipping event config: {}", WRAPPER_API));

        circuitBreakerRegistry.getAllCircuitBreakers()
                .stream()
                .filter(circuitBreaker -> circuitBreaker.getName().equals(WRAPPER_API))
                .findFirst()
                .ifPresent(circuitBreaker -> circuitBreaker.getEventPublisher()
                        .onStateTransition(event -> log.warn("CIRCUIT_TRANSITION name={} transition={}",
                                event.getCircuitBreakerName(), event.getStateTransition())));
    }

    private void logRetryAttempt(RetryOnRetryEvent event) {
        log.warn("RETRY_ATTEMPT name={} attempt={}/{} error={}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getRetry().getRetryConfig().getMaxAttempts(),
                event.getLastThrowable().getClass().getSimpleName());
    }

    private void logRetrySuccess(RetryOnSuccessEvent event) {
        if (event.getNumberOfRetryAttempts() > 0) {
            log.info("RETRY_SUCCESS name={} attempts={}", event.getName(), event.getNumberOfRetryAttempts());
        }
    }

    private void logRetryError(RetryOnErrorEvent event) {
        int maxAttempts = event.getRetry().getRetryConfig().getMaxAttempts();
        if (event.getNumberOfRetryAttempts() >= maxAttempts) {
            log.warn("RETRY_EXHAUSTED name={} attempts={} error={}",
                    event.getName(),
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable().getClass().getSimpleName());
        }
    }
}

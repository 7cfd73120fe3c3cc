package com.openforge.conceptai.llm;

import com.openforge.conceptai.common.ConfigurationException;
import com.openforge.conceptai.common.NotFoundException;
import com.openforge.conceptai.common.ProviderException;
import com.openforge.conceptai.common.ValidationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Programmatic Resilience4j wiring for provider calls.
 *
 * Call graph for one provider call:
 *
 *   circuitBreaker(provider)
 *     └─ retry(provider)          - ProviderException only, capped exponential backoff
 *           └─ provider.{complete|completeJson|embed}
 *
 * JSON completions add an outer re-issue loop:
 *
 *   retry("json")                 - ValidationException only
 *     └─ (call graph above)
 *
 * Credential, not-found and validation failures are never retried by the
 * provider retry; validation failures are owned by the JSON loop.
 */
public class LlmResilience {

    static final String JSON_RETRY = "json";

    private final RetryRegistry          retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public LlmResilience(RetryRegistry retryRegistry, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.retryRegistry          = retryRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    /** Builds both registries from configuration. */
    public static LlmResilience from(LlmProperties.RetrySettings retry, int jsonMaxAttempts) {
        RetryConfig providerRetry = RetryConfig.custom()
                .maxAttempts(Math.max(1, retry.maxAttempts()))
                // exponential back-off: 1 s → 2 s → 4 s …, never above maxBackoff
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retry.initialBackoff(), retry.multiplier(), retry.maxBackoff()))
                .retryExceptions(ProviderException.class)
                .ignoreExceptions(ConfigurationException.class, NotFoundException.class, ValidationException.class)
                .build();

        RetryConfig jsonRetry = RetryConfig.custom()
                .maxAttempts(Math.max(1, jsonMaxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(200), 2.0, retry.maxBackoff()))
                .retryExceptions(ValidationException.class)
                .build();

        RetryRegistry retryRegistry = RetryRegistry.of(providerRetry);
        retryRegistry.addConfiguration(JSON_RETRY, jsonRetry);

        CircuitBreakerConfig breaker = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // a bad key or bad JSON says nothing about provider health
                .recordExceptions(ProviderException.class)
                .build();

        CircuitBreakerRegistry breakerRegistry = CircuitBreakerRegistry.of(breaker);
        for (ProviderType type : ProviderType.values()) {
            retryRegistry.retry(type.id());
            breakerRegistry.circuitBreaker(type.id());
        }
        return new LlmResilience(retryRegistry, breakerRegistry);
    }

    /** Decorates a single provider call with that provider's breaker and retry, then runs it. */
    public <T> T call(ProviderType type, Supplier<T> call) {
        CircuitBreaker cb    = circuitBreakerRegistry.circuitBreaker(type.id());
        Retry          retry = retryRegistry.retry(type.id());
        try {
            return CircuitBreaker.decorateSupplier(cb, Retry.decorateSupplier(retry, call)).get();
        } catch (CallNotPermittedException e) {
            throw new ProviderException("Circuit for provider [%s] is open".formatted(type.id()), e);
        }
    }

    /** Re-issues {@code call} while it fails with {@link ValidationException}. */
    public <T> T reissueUntilValid(Supplier<T> call) {
        Retry retry = retryRegistry.retry(JSON_RETRY, JSON_RETRY);
        return Retry.decorateSupplier(retry, call).get();
    }

    public RetryRegistry retryRegistry() {
        return retryRegistry;
    }

    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }
}

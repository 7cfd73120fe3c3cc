package com.openforge.conceptai.config;

import com.openforge.conceptai.llm.LlmProperties;
import com.openforge.conceptai.llm.LlmResilience;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One retry and one circuit breaker per provider ("gemini", "openai"), plus
 * the "json" retry that re-issues a completion whose answer did not parse.
 * The registries are exposed so their instances can be inspected at runtime.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public LlmResilience llmResilience(LlmProperties properties) {
        return LlmResilience.from(properties.retry(), properties.jsonMaxAttempts());
    }

    @Bean
    public RetryRegistry retryRegistry(LlmResilience llmResilience) {
        return llmResilience.retryRegistry();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(LlmResilience llmResilience) {
        return llmResilience.circuitBreakerRegistry();
    }
}

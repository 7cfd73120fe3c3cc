package com.openforge.conceptai.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Core infrastructure beans:
 *  - background executor → startup backfill and fire-and-forget hosted-context uploads
 *  - Java HttpClient     → the only HTTP engine for provider calls
 *  - Jackson ObjectMapper → Java time, tolerant deserialization
 *  - Clock               → every expiry and timestamp decision reads this
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Small bounded pool.  Work here is best-effort, so when the queue is full
     * the submitting thread runs the task itself instead of dropping it.
     * Shut down with the context (inferred {@code shutdown} destroy method).
     */
    @Bean
    public ExecutorService backgroundExecutor() {
        return new ThreadPoolExecutor(
                2, 4,
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(256),
                new CustomizableThreadFactory("concept-bg-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Single, shared HttpClient instance.  Connect timeout only; per-request
     * read timeouts are set by each provider.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - ISO-8601 dates, NOT timestamps
     *  - unknown properties ignored, so provider APIs can add fields without breaking us
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.openforge.conceptai.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * concept:
 *   session:
 *     default-ttl: 1h
 *     external-cache-threshold-chars: 2000
 *     external-cache-ttl: 1h
 *     cleanup-interval: PT10M   # ISO-8601, also read by the scheduled sweep
 */
@ConfigurationProperties(prefix = "concept.session")
public record ContextSessionProperties(
        @DefaultValue("1h") Duration defaultTtl,
        @DefaultValue("2000") int externalCacheThresholdChars,
        @DefaultValue("1h") Duration externalCacheTtl,
        @DefaultValue("10m") Duration cleanupInterval
) {}

package com.openforge.conceptai.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * concept:
 *   semantic-cache:
 *     enabled: true
 *     similarity-threshold: 0.95   # cosine similarity needed for a hit
 *     candidate-window: 100        # most-recently-used entries compared per lookup
 *     max-entries: 0               # per (provider, model); 0 = no retention policy
 */
@ConfigurationProperties(prefix = "concept.semantic-cache")
public record SemanticCacheProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("0.95") double similarityThreshold,
        @DefaultValue("100") int candidateWindow,
        @DefaultValue("0") int maxEntries
) {}

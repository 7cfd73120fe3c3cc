package com.openforge.conceptai.config;

import com.openforge.conceptai.cache.SemanticCacheProperties;
import com.openforge.conceptai.embedding.EmbeddingProperties;
import com.openforge.conceptai.llm.LlmClient;
import com.openforge.conceptai.llm.LlmProperties;
import com.openforge.conceptai.llm.ProviderType;
import com.openforge.conceptai.session.ContextSessionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary after the application context is ready:
 * store connection, active provider, configured keys (masked), cache and
 * session settings.
 */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource               dataSource;
    private final LlmProperties            llmProperties;
    private final LlmClient                llmClient;
    private final EmbeddingProperties      embeddingProperties;
    private final SemanticCacheProperties  cacheProperties;
    private final ContextSessionProperties sessionProperties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            Concept AI Core  —  Startup Summary           ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Store                                                   ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM                                                     ║
                ║    Active         : {}  [{}]  temperature={}
                ║    Embedding model: {}
                ║    gemini key     : {}
                ║    openai key     : {}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Batch size     : {}  max-iterations={}
                ║    Startup fill   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Semantic cache                                          ║
                ║    Enabled        : {}  threshold={}  window={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Context sessions                                        ║
                ║    Default TTL    : {}  hosted-context ≥ {} chars
                ╚══════════════════════════════════════════════════════════╝
                """,
                checkDatabase(),

                llmClient.getProviderType().id(), llmClient.getModel(), llmClient.getTemperature(),
                llmClient.embeddingModel(),
                maskKey(apiKey(ProviderType.GEMINI)),
                maskKey(apiKey(ProviderType.OPENAI)),
                llmProperties.fallbackEnabled() ? "✔ enabled" : "✘ disabled",

                embeddingProperties.batchSize(), embeddingProperties.maxIterations(),
                embeddingProperties.backfillOnStartup() ? "✔ enabled" : "✘ disabled",

                cacheProperties.enabled(), cacheProperties.similarityThreshold(), cacheProperties.candidateWindow(),

                sessionProperties.defaultTtl(), sessionProperties.externalCacheThresholdChars()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }

    private String apiKey(ProviderType type) {
        LlmProperties.ProviderConfig config = llmProperties.config(type);
        return config == null ? null : config.apiKey();
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" for blank or placeholder keys.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.endsWith("-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}

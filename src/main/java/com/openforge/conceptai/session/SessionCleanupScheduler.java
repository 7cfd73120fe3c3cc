package com.openforge.conceptai.session;

import com.openforge.conceptai.llm.LlmClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep of expired context sessions, releasing their hosted context
 * on the way out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCleanupScheduler {

    private final ContextSessionService sessions;
    private final LlmClient             llmClient;

    @Scheduled(
            fixedDelayString   = "${concept.session.cleanup-interval:PT10M}",
            initialDelayString = "${concept.session.cleanup-interval:PT10M}")
    public void sweep() {
        try {
            int removed = sessions.cleanupExpiredSessions(llmClient);
            if (removed > 0) {
                log.info("[ContextSession] Sweep removed {} expired sessions", removed);
            }
        } catch (RuntimeException e) {
            log.warn("[ContextSession] Expired-session sweep failed: {}", e.getMessage(), e);
        }
    }
}

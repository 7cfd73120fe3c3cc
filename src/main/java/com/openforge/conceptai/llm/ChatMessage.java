package com.openforge.conceptai.llm;

/**
 * A single conversation turn.
 *
 * role variants:
 *   "system"    - persona / instructions
 *   "user"      - human turn
 *   "assistant" - model reply
 */
public record ChatMessage(String role, String content) {

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage("assistant", content);
    }
}

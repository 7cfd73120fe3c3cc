package com.openforge.conceptai.llm;

import lombok.Builder;

import java.util.List;

/**
 * Everything the façade needs for one completion.
 *
 * useCache   - consult and populate the semantic response cache
 * sessionKey - context session whose provider-side cache handle, if live,
 *              is attached to the call; ignored by providers without
 *              context caching
 * maxTokens / temperature - null means provider default / client temperature
 */
@Builder(toBuilder = true)
public record CompletionRequest(
        String prompt,
        String systemPrompt,
        Integer maxTokens,
        Double temperature,
        List<ChatMessage> history,
        boolean useCache,
        String sessionKey
) {

    public static CompletionRequest of(String prompt) {
        return CompletionRequest.builder().prompt(prompt).build();
    }

    public static CompletionRequest of(String prompt, String systemPrompt) {
        return CompletionRequest.builder().prompt(prompt).systemPrompt(systemPrompt).build();
    }

    public List<ChatMessage> historyOrEmpty() {
        return history == null ? List.of() : history;
    }

    /** Text the semantic cache is keyed on: system prompt and prompt together. */
    public String cacheKeyText() {
        if (systemPrompt == null || systemPrompt.isBlank()) return prompt;
        return systemPrompt + "\n\n" + prompt;
    }
}

package com.openforge.conceptai.llm;

import java.util.Optional;

/** Per-provider credential lookup.  Empty means "not configured". */
public interface CredentialSource {

    Optional<String> apiKey(ProviderType type);
}

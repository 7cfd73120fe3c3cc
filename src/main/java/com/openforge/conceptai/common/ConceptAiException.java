package com.openforge.conceptai.common;

/**
 * Root of every failure raised by the embedding, caching and LLM layers.
 *
 * All subtypes are unchecked: callers decide at their own boundary whether a
 * failure is fatal (primary completion path) or degradable (secondary caches).
 */
public class ConceptAiException extends RuntimeException {

    public ConceptAiException(String message) { super(message); }

    public ConceptAiException(String message, Throwable cause) { super(message, cause); }
}

package com.openforge.conceptai.common;

/**
 * Transient provider failure: network error, 5xx, model temporarily unavailable.
 * Eligible for bounded backoff retry.
 */
public class ProviderException extends ConceptAiException {

    public ProviderException(String message) { super(message); }

    public ProviderException(String message, Throwable cause) { super(message, cause); }
}

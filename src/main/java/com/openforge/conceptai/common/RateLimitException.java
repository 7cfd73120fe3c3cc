package com.openforge.conceptai.common;

/** HTTP 429 from a provider. */
public class RateLimitException extends ProviderException {

    public RateLimitException(String message) { super(message); }
}

package com.openforge.conceptai.common;

/**
 * Missing or rejected provider credential.
 * Fatal and immediate: never retried, and the caller's state is left unchanged.
 */
public class ConfigurationException extends ConceptAiException {

    public ConfigurationException(String message) { super(message); }

    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}

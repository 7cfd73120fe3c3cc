package com.openforge.conceptai.common;

/**
 * A provider answered, but not with a well-formed JSON object.
 * Retried by re-issuing the request a bounded number of times.
 */
public class ValidationException extends ConceptAiException {

    public ValidationException(String message) { super(message); }

    public ValidationException(String message, Throwable cause) { super(message, cause); }
}

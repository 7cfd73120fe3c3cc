package com.openforge.conceptai.session;

import java.util.StringJoiner;

/**
 * Deterministic session keys, so repeated logical conversations converge on
 * one row: {@code operation[:conceptId][:disambiguator]}.
 */
public final class SessionKeys {

    private SessionKeys() {
    }

    public static String of(String operation) {
        return of(operation, null, null);
    }

    public static String of(String operation, String conceptId) {
        return of(operation, conceptId, null);
    }

    public static String of(String operation, String conceptId, String disambiguator) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Session key needs an operation name");
        }
        StringJoiner key = new StringJoiner(":");
        key.add(operation);
        if (conceptId != null && !conceptId.isBlank()) key.add(conceptId);
        if (disambiguator != null && !disambiguator.isBlank()) key.add(disambiguator);
        return key.toString();
    }
}

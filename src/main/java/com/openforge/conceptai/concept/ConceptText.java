package com.openforge.conceptai.concept;

/**
 * Read-only projection of a concept: just what is needed to embed it.
 */
public record ConceptText(
        String id,
        String title,
        String description,
        String content
) {

    /** title, description and content joined by newlines; a missing description leaves an empty line. */
    public String embeddingText() {
        return "%s\n%s\n%s".formatted(
                title,
                description == null ? "" : description,
                content == null ? "" : content);
    }
}

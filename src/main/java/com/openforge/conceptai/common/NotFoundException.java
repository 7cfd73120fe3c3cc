package com.openforge.conceptai.common;

public class NotFoundException extends ConceptAiException {

    private final String id;

    public NotFoundException(String kind, String id) {
        super("%s %s not found".formatted(kind, id));
        this.id = id;
    }

    public String getId() {
        return id;
    }
}

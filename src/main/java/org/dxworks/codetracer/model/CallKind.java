package org.dxworks.codetracer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallKind {
    FUNCTION("function"),
    METHOD("method");

    private final String name;

    CallKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}

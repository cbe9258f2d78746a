package org.dxworks.codetracer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeKind {
    FUNCTION("function"),
    METHOD("method"),
    ENDPOINT("endpoint"),
    HANDLER("handler");

    private final String name;

    NodeKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}

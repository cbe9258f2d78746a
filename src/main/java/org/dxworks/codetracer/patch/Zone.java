package org.dxworks.codetracer.patch;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Header lines hold instrumentation imports and configuration, body lines the function itself.
 */
public enum Zone {
    HEADER("header"),
    BODY("body");

    private final String name;

    Zone(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}

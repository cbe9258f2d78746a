package org.dxworks.codetracer.patch;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeTag {
    KEEP("keep", " "),
    ADD("add", "+"),
    REMOVE("remove", "-");

    private final String name;
    private final String symbol;

    ChangeTag(String name, String symbol) {
        this.name = name;
        this.symbol = symbol;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public String getSymbol() {
        return symbol;
    }
}

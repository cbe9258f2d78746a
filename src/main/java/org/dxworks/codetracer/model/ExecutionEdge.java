package org.dxworks.codetracer.model;

import java.util.Objects;

public class ExecutionEdge {
    public final String from;
    public final String to;

    public ExecutionEdge(String from, String to) {
        this.from = from;
        this.to = to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionEdge)) return false;
        ExecutionEdge that = (ExecutionEdge) o;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}

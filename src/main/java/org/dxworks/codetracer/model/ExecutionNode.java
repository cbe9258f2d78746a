package org.dxworks.codetracer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One function in the call graph, identified by {@code file:name}.
 * Children are kept as ids into the owning {@link ExecutionTree}, so a function
 * reached from several callers stays a single node.
 */
public class ExecutionNode {
    public final String id;
    public final String name;
    public final SourceLocation location;
    public final int endLine;
    public final NodeKind kind;
    public final NodeMetadata metadata;
    private final List<String> children = new ArrayList<>();

    public ExecutionNode(String name, SourceLocation location, int endLine, NodeKind kind, NodeMetadata metadata) {
        this.id = idOf(location.file, name);
        this.name = name;
        this.location = location;
        this.endLine = Math.max(endLine, location.line);
        this.kind = kind;
        this.metadata = metadata != null ? metadata : new NodeMetadata();
    }

    public static String idOf(String file, String name) {
        return file + ":" + name;
    }

    public List<String> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Appends a child id unless it is already present.
     *
     * @return true when the child was added
     */
    public synchronized boolean addChild(String childId) {
        if (children.contains(childId)) {
            return false;
        }
        children.add(childId);
        return true;
    }

    @JsonIgnore
    public String getFile() {
        return location.file;
    }

    @JsonIgnore
    public int getLine() {
        return location.line;
    }

    @Override
    public String toString() {
        return id + "@" + location.line;
    }
}

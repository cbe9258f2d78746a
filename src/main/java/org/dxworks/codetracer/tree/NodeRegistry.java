package org.dxworks.codetracer.tree;

import org.dxworks.codetracer.model.ExecutionNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The single owner of every node created during one build, keyed by {@code file:name}.
 * Insertion order is discovery order.
 */
public class NodeRegistry {
    private final Map<String, ExecutionNode> nodes = new LinkedHashMap<>();

    public synchronized Optional<ExecutionNode> find(String file, String name) {
        return Optional.ofNullable(nodes.get(ExecutionNode.idOf(file, name)));
    }

    /**
     * Returns the node registered under {@code file:name}, creating it on first use.
     * Two callers racing for the same id get the same instance.
     */
    public synchronized ExecutionNode getOrCreate(String file, String name, Supplier<ExecutionNode> factory) {
        return nodes.computeIfAbsent(ExecutionNode.idOf(file, name), id -> {
            ExecutionNode node = factory.get();
            if (!id.equals(node.id)) {
                throw new IllegalStateException("Factory for " + id + " produced node " + node.id);
            }
            return node;
        });
    }

    public synchronized int size() {
        return nodes.size();
    }

    public synchronized Map<String, ExecutionNode> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }
}

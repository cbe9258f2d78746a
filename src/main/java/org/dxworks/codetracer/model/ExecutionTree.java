package org.dxworks.codetracer.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The graph of statically resolved calls reachable from {@link #root}.
 */
public class ExecutionTree {
    public final String root;
    public final Map<String, ExecutionNode> nodes;
    public final List<ExecutionEdge> edges;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> warnings;

    public ExecutionTree(String root, Map<String, ExecutionNode> nodes, List<String> warnings) {
        if (!nodes.containsKey(root)) {
            throw new IllegalArgumentException("Root " + root + " is not among the tree nodes");
        }
        this.root = root;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableList(edgesOf(this.nodes));
        this.warnings = List.copyOf(warnings);
    }

    /**
     * One edge per parent-to-child relation, regenerated from the children lists.
     */
    private static List<ExecutionEdge> edgesOf(Map<String, ExecutionNode> nodes) {
        List<ExecutionEdge> result = new ArrayList<>();
        for (ExecutionNode node : nodes.values()) {
            for (String child : node.getChildren()) {
                if (!nodes.containsKey(child)) {
                    throw new IllegalStateException("Edge " + node.id + " -> " + child + " points outside the tree");
                }
                result.add(new ExecutionEdge(node.id, child));
            }
        }
        return result;
    }

    public Optional<ExecutionNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public ExecutionNode rootNode() {
        return nodes.get(root);
    }

    public boolean isRoot(ExecutionNode node) {
        return root.equals(node.id);
    }
}

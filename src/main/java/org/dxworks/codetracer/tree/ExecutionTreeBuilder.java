package org.dxworks.codetracer.tree;

import org.dxworks.codetracer.LanguageRegistry;
import org.dxworks.codetracer.analyzer.LanguageFrontEnd;
import org.dxworks.codetracer.model.CallSite;
import org.dxworks.codetracer.model.ExecutionNode;
import org.dxworks.codetracer.model.ExecutionTree;
import org.dxworks.codetracer.source.ProjectFiles;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the execution tree reachable from an entry function with a depth-first walk.
 * A callee that is still being visited further up the walk is not attached, so the
 * result never contains a cycle. Failures on one node are recorded as warnings and the
 * node becomes a leaf.
 */
public class ExecutionTreeBuilder {
    private final ProjectFiles files;
    private final LanguageRegistry languages;

    public ExecutionTreeBuilder(ProjectFiles files, LanguageRegistry languages) {
        this.files = files;
        this.languages = languages;
    }

    public ExecutionTree build(String entryFile, String entryFunction) throws IOException {
        List<String> projectFiles = files.list();
        List<String> warnings = new ArrayList<>();
        NodeRegistry nodes = new NodeRegistry();
        CallResolver resolver = new CallResolver(files, languages, nodes, projectFiles, message -> warn(warnings, message));

        System.out.println("Building execution tree from " + entryFile + ":" + entryFunction
                + " (" + projectFiles.size() + " project files)");

        ExecutionNode root = resolver.entryNode(entryFile, entryFunction);
        Map<String, VisitState> states = new HashMap<>();
        visit(root, resolver, states, warnings);

        System.out.println("Execution tree has " + nodes.size() + " nodes");
        return new ExecutionTree(root.id, nodes.asMap(), warnings);
    }

    private void visit(ExecutionNode node, CallResolver resolver, Map<String, VisitState> states, List<String> warnings) {
        states.put(node.id, VisitState.VISITING);

        List<CallSite> calls;
        try {
            Optional<LanguageFrontEnd> frontEnd = languages.frontEndFor(node.getFile());
            if (frontEnd.isEmpty()) {
                warn(warnings, "No front-end for " + node.getFile() + ", " + node.id + " has no children");
                states.put(node.id, VisitState.VISITED);
                return;
            }
            calls = frontEnd.get().findCallsWithin(node.name, resolver.contentOf(node.getFile()));
        } catch (IOException | RuntimeException e) {
            warn(warnings, "Could not analyze " + node.id + ": " + e.getMessage());
            states.put(node.id, VisitState.VISITED);
            return;
        }

        for (CallSite site : calls) {
            ExecutionNode child;
            try {
                child = resolver.resolve(site, node.getFile());
            } catch (RuntimeException e) {
                warn(warnings, "Could not resolve " + site + " in " + node.id + ": " + e.getMessage());
                continue;
            }
            if (child == null) {
                continue;
            }

            VisitState childState = states.getOrDefault(child.id, VisitState.UNVISITED);
            if (childState == VisitState.VISITING) {
                // back edge (recursion), would close a cycle
                continue;
            }
            node.addChild(child.id);
            if (childState == VisitState.UNVISITED) {
                visit(child, resolver, states, warnings);
            }
        }

        states.put(node.id, VisitState.VISITED);
    }

    private static void warn(List<String> warnings, String message) {
        warnings.add(message);
        System.err.println("Warning: " + message);
    }
}

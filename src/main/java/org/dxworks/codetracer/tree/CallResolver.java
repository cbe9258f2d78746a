package org.dxworks.codetracer.tree;

import org.dxworks.codetracer.LanguageRegistry;
import org.dxworks.codetracer.analyzer.LanguageFrontEnd;
import org.dxworks.codetracer.model.AssignmentBinding;
import org.dxworks.codetracer.model.CallSite;
import org.dxworks.codetracer.model.ExecutionNode;
import org.dxworks.codetracer.model.FunctionDefinition;
import org.dxworks.codetracer.model.ImportBinding;
import org.dxworks.codetracer.model.NodeKind;
import org.dxworks.codetracer.model.SourceLocation;
import org.dxworks.codetracer.source.ProjectFiles;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Maps a call site to the node of the function it calls. Candidates are tried from the
 * closest to the farthest: the node registry, the calling file, the file an import chain
 * points to, then every other project file in sorted order. The first hit wins.
 */
public class CallResolver {
    private final ProjectFiles files;
    private final LanguageRegistry languages;
    private final NodeRegistry nodes;
    private final List<String> projectFiles;
    private final Set<String> projectFileSet;
    private final Consumer<String> warnings;

    private final Map<String, String> contents = new HashMap<>();
    private final Map<String, Optional<FunctionDefinition>> definitions = new HashMap<>();
    private final Map<String, ExecutionNode> globalHits = new HashMap<>();
    private final Set<String> unreadable = new LinkedHashSet<>();

    public CallResolver(ProjectFiles files,
                        LanguageRegistry languages,
                        NodeRegistry nodes,
                        List<String> projectFiles,
                        Consumer<String> warnings) {
        this.files = files;
        this.languages = languages;
        this.nodes = nodes;
        this.projectFiles = List.copyOf(projectFiles);
        this.projectFileSet = new LinkedHashSet<>(projectFiles);
        this.warnings = warnings;
    }

    /**
     * The node for the entry function. Falls back to line 1 when the definition cannot be found.
     */
    public ExecutionNode entryNode(String file, String name) {
        Optional<FunctionDefinition> definition = Optional.empty();
        try {
            definition = definitionIn(file, name);
        } catch (IOException e) {
            warnings.accept("Could not read entry file " + file + ": " + e.getMessage());
        }
        if (definition.isEmpty()) {
            warnings.accept("Entry " + name + " not found in " + file + ", assuming line 1");
        }

        Optional<FunctionDefinition> found = definition;
        return nodes.getOrCreate(file, name, () -> found
                .map(d -> new ExecutionNode(name, new SourceLocation(file, d.startLine), d.endLine, d.kind, d.metadata))
                .orElseGet(() -> new ExecutionNode(name, new SourceLocation(file, 1), 1, NodeKind.FUNCTION, null)));
    }

    /**
     * @return the callee node, or null when the call cannot be resolved statically
     *         (built-ins, library calls, dynamic dispatch)
     */
    public ExecutionNode resolve(CallSite site, String currentFile) {
        Optional<ExecutionNode> known = nodes.find(currentFile, site.name);
        if (known.isPresent()) {
            return known.get();
        }

        try {
            Optional<FunctionDefinition> local = definitionIn(currentFile, site.name);
            if (local.isPresent()) {
                return nodeFor(site, currentFile, site.name, local.get());
            }
        } catch (IOException e) {
            warnings.accept("Could not read " + currentFile + ": " + e.getMessage());
            return null;
        }

        ExecutionNode imported = resolveThroughImports(site, currentFile);
        if (imported != null) {
            return imported;
        }
        return resolveGlobally(site, currentFile);
    }

    /**
     * {@code svc = UserService(); svc.save()} resolves {@code svc} to {@code UserService}, the import
     * that brought {@code UserService} in, the file that import names, and {@code save} in that file.
     * Plain calls follow the import of their own name.
     */
    private ExecutionNode resolveThroughImports(CallSite site, String currentFile) {
        Optional<LanguageFrontEnd> frontEnd = languages.frontEndFor(currentFile);
        if (frontEnd.isEmpty()) {
            return null;
        }

        String content;
        try {
            content = contentOf(currentFile);
        } catch (IOException e) {
            return null;
        }

        String origin;
        String lookupName = site.name;
        if (site.isMethodCall()) {
            if (site.receiver == null) {
                return null;
            }
            origin = site.receiver;
            for (AssignmentBinding assignment : frontEnd.get().findAssignments(content)) {
                if (assignment.variable.equals(site.receiver)) {
                    origin = assignment.constructorName;
                    break;
                }
            }
        } else {
            origin = site.name;
        }

        ImportBinding binding = null;
        for (ImportBinding candidate : frontEnd.get().findImports(content)) {
            if (origin.equals(candidate.localName)) {
                binding = candidate;
                break;
            }
        }
        if (binding == null) {
            return null;
        }
        if (!site.isMethodCall() && binding.importedName != null && !"default".equals(binding.importedName)) {
            lookupName = binding.importedName;
        }

        for (String candidateFile : frontEnd.get().moduleCandidates(binding, currentFile)) {
            if (!projectFileSet.contains(candidateFile)) continue;
            Optional<ExecutionNode> known = nodes.find(candidateFile, lookupName);
            if (known.isPresent()) {
                return known.get();
            }
            try {
                Optional<FunctionDefinition> definition = definitionIn(candidateFile, lookupName);
                if (definition.isPresent()) {
                    return nodeFor(site, candidateFile, lookupName, definition.get());
                }
            } catch (IOException e) {
                warnOnce(candidateFile, e);
            }
        }
        return null;
    }

    private ExecutionNode resolveGlobally(CallSite site, String currentFile) {
        String cacheKey = currentFile + "|" + site.name;
        if (globalHits.containsKey(cacheKey)) {
            return globalHits.get(cacheKey);
        }

        ExecutionNode result = null;
        for (String file : projectFiles) {
            if (file.equals(currentFile)) continue;
            Optional<ExecutionNode> known = nodes.find(file, site.name);
            if (known.isPresent()) {
                result = known.get();
                break;
            }
            try {
                Optional<FunctionDefinition> definition = definitionIn(file, site.name);
                if (definition.isPresent()) {
                    result = nodeFor(site, file, site.name, definition.get());
                    break;
                }
            } catch (IOException e) {
                warnOnce(file, e);
            }
        }
        globalHits.put(cacheKey, result);
        return result;
    }

    private ExecutionNode nodeFor(CallSite site, String file, String name, FunctionDefinition definition) {
        NodeKind kind = kindOf(site, definition);
        return nodes.getOrCreate(file, name, () -> new ExecutionNode(
                name, new SourceLocation(file, definition.startLine), definition.endLine, kind, definition.metadata));
    }

    static NodeKind kindOf(CallSite site, FunctionDefinition definition) {
        if (site.handlerReference) {
            return NodeKind.HANDLER;
        }
        // module functions called as helpers.fn() stay functions
        return definition.kind;
    }

    private Optional<FunctionDefinition> definitionIn(String file, String name) throws IOException {
        String key = ExecutionNode.idOf(file, name);
        Optional<FunctionDefinition> cached = definitions.get(key);
        if (cached != null) {
            return cached;
        }
        Optional<LanguageFrontEnd> frontEnd = languages.frontEndFor(file);
        Optional<FunctionDefinition> definition = Optional.empty();
        if (frontEnd.isPresent()) {
            definition = frontEnd.get().findDefinition(name, contentOf(file), file);
        }
        definitions.put(key, definition);
        return definition;
    }

    /**
     * File content, read once per build.
     */
    public String contentOf(String file) throws IOException {
        String content = contents.get(file);
        if (content == null) {
            content = files.read(file);
            contents.put(file, content);
        }
        return content;
    }

    private void warnOnce(String file, IOException e) {
        if (unreadable.add(file)) {
            warnings.accept("Could not read " + file + ": " + e.getMessage());
        }
    }
}

package org.dxworks.codetracer.source;

import org.dxworks.codetracer.LanguageRegistry;
import org.dxworks.codetracer.model.ExecutionNode;
import org.dxworks.codetracer.model.FunctionDefinition;

import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;

/**
 * Cuts the source text of one function out of its file.
 */
public class FunctionSourceExtractor {
    private final ProjectFiles files;
    private final LanguageRegistry registry;

    public FunctionSourceExtractor(ProjectFiles files, LanguageRegistry registry) {
        this.files = files;
        this.registry = registry;
    }

    /**
     * The exact lines of the node's definition, joined with '\n'. The definition is looked up
     * again so edits made since the tree was built are picked up; the recorded range is used
     * when the lookup fails.
     */
    public Extract extract(ExecutionNode node) throws IOException {
        String content = files.read(node.getFile());
        int startLine = node.getLine();
        int endLine = node.endLine;

        Optional<FunctionDefinition> definition = registry.frontEndFor(node.getFile())
                .flatMap(frontEnd -> frontEnd.findDefinition(node.name, content, node.getFile()));
        if (definition.isPresent()) {
            startLine = definition.get().startLine;
            endLine = definition.get().endLine;
        }
        return new Extract(startLine, endLine, slice(content, startLine, endLine));
    }

    /**
     * Lines {@code startLine..endLine} (1-based, inclusive) of {@code content}, clamped to the file.
     */
    public static String slice(String content, int startLine, int endLine) {
        String[] lines = content.split("\n", -1);
        int from = Math.max(1, startLine) - 1;
        int to = Math.min(lines.length, endLine);
        if (from >= to) {
            return "";
        }
        return String.join("\n", Arrays.copyOfRange(lines, from, to));
    }

    public static class Extract {
        public final int startLine;
        public final int endLine;
        public final String code;

        public Extract(int startLine, int endLine, String code) {
            this.startLine = startLine;
            this.endLine = endLine;
            this.code = code;
        }
    }
}

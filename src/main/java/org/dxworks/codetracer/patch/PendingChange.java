package org.dxworks.codetracer.patch;

import org.dxworks.codetracer.model.ExecutionNode;

import java.util.List;

/**
 * An accepted rewrite of one function, waiting for the batch apply of its file.
 */
public class PendingChange {
    public final ExecutionNode node;
    public final NormalizedCodeBlock originalBlock;
    public final StructuredDelta delta;

    public PendingChange(ExecutionNode node, NormalizedCodeBlock originalBlock, StructuredDelta delta) {
        if (!originalBlock.isValid()) {
            throw new IllegalArgumentException("Original code of " + node.id + " is not a valid block: "
                    + originalBlock.getViolation());
        }
        this.node = node;
        this.originalBlock = originalBlock;
        this.delta = delta;
    }

    public String getFile() {
        return node.getFile();
    }

    public int startLine() {
        return originalBlock.getFunctionStartLine();
    }

    public int endLine() {
        return originalBlock.bodyEndLine();
    }

    public List<String> originalBody() {
        return originalBlock.bodyTexts();
    }

    @Override
    public String toString() {
        return node.id + "[" + startLine() + ".." + endLine() + "]";
    }
}

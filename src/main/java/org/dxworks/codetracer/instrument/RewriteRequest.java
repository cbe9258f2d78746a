package org.dxworks.codetracer.instrument;

import org.dxworks.codetracer.model.ExecutionNode;
import org.dxworks.codetracer.model.ExecutionTree;

/**
 * What the external rewrite service gets for one function: its code and the whole call graph
 * around it.
 */
public class RewriteRequest {
    public TargetFunction targetFunction;
    public String originalCode;
    public ExecutionTree fullNodeGraph;
    public boolean isEntryPoint;

    public static class TargetFunction {
        public String name;
        public String file;
        public int line;

        public TargetFunction(String name, String file, int line) {
            this.name = name;
            this.file = file;
            this.line = line;
        }
    }

    public static RewriteRequest of(ExecutionNode node, int startLine, String originalCode, ExecutionTree tree) {
        RewriteRequest request = new RewriteRequest();
        request.targetFunction = new TargetFunction(node.name, node.getFile(), startLine);
        request.originalCode = originalCode;
        request.fullNodeGraph = tree;
        request.isEntryPoint = tree.isRoot(node);
        return request;
    }
}

package org.dxworks.codetracer.model;

/**
 * Where a function, method or route handler is defined in one file.
 * The line range covers the outermost declaration (export, decorators, route registration).
 */
public class FunctionDefinition {
    public String name;
    public int startLine;
    public int endLine;
    public NodeKind kind = NodeKind.FUNCTION;
    public NodeMetadata metadata = new NodeMetadata();
}

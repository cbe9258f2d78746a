package org.dxworks.codetracer.tree;

/**
 * Traversal state of one node. Every node moves forward through these states at most once.
 */
public enum VisitState {
    UNVISITED,
    VISITING,
    VISITED
}

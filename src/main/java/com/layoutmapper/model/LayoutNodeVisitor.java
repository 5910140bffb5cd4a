package com.layoutmapper.model;

/**
 * Visitor for depth-first pre-order traversal of a layout tree.
 */
@FunctionalInterface
public interface LayoutNodeVisitor {
    void visit(LayoutNode node, int depth);
}

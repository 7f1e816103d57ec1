package com.ansible.visualizer.model;

/**
 * Visitor pattern interface for traversing an extracted task tree.
 */
public interface TaskNodeVisitor {
    void visit(PlainTaskNode task);
    void visit(BlockNode block);
    void visit(RoleRefNode roleRef);
    void visit(IncludeNode include);
}

package com.ansible.visualizer.model;

import java.util.Collection;

/**
 * Counts every node of a task tree, including block children and include expansions.
 */
public class TaskNodeCounter implements TaskNodeVisitor {

    private int count;

    public static int count(Collection<? extends TaskNode> tasks) {
        TaskNodeCounter counter = new TaskNodeCounter();
        tasks.forEach(task -> task.accept(counter));
        return counter.getCount();
    }

    public int getCount() {
        return count;
    }

    @Override
    public void visit(PlainTaskNode task) {
        count++;
    }

    @Override
    public void visit(BlockNode block) {
        count++;
        block.getChildren().forEach(child -> child.accept(this));
    }

    @Override
    public void visit(RoleRefNode roleRef) {
        count++;
    }

    @Override
    public void visit(IncludeNode include) {
        count++;
        include.getIncluded().forEach(child -> child.accept(this));
    }
}

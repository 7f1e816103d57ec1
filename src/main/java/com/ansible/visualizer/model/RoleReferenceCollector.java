package com.ansible.visualizer.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects every role name referenced by RoleRef nodes anywhere in a task tree,
 * including block children and include expansions.
 */
public class RoleReferenceCollector implements TaskNodeVisitor {

    private final Set<String> roleNames = new LinkedHashSet<>();

    public static Set<String> collect(Collection<? extends TaskNode> tasks) {
        RoleReferenceCollector collector = new RoleReferenceCollector();
        tasks.forEach(task -> task.accept(collector));
        return collector.getRoleNames();
    }

    public Set<String> getRoleNames() {
        return roleNames;
    }

    @Override
    public void visit(PlainTaskNode task) {
        // leaf, nothing to collect
    }

    @Override
    public void visit(BlockNode block) {
        block.getChildren().forEach(child -> child.accept(this));
    }

    @Override
    public void visit(RoleRefNode roleRef) {
        roleNames.add(roleRef.getRoleName());
    }

    @Override
    public void visit(IncludeNode include) {
        include.getIncluded().forEach(child -> child.accept(this));
    }
}

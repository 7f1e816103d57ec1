package com.ansible.visualizer.model;

import java.util.Objects;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An {@code include_role} / {@code import_role} task.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class RoleRefNode extends TaskNode {

    private final String roleName;

    @Builder
    public RoleRefNode(TaskMetadata metadata, String roleName) {
        super(metadata);
        this.roleName = Objects.requireNonNull(roleName, "roleName");
    }

    @Override
    public void accept(TaskNodeVisitor visitor) {
        visitor.visit(this);
    }
}

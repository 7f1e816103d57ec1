package com.ansible.visualizer.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A regular module invocation (leaf of the task tree).
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class PlainTaskNode extends TaskNode {

    @Builder
    public PlainTaskNode(TaskMetadata metadata) {
        super(metadata);
    }

    @Override
    public void accept(TaskNodeVisitor visitor) {
        visitor.visit(this);
    }
}

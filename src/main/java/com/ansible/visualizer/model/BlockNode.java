package com.ansible.visualizer.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A {@code block} with its {@code rescue} and {@code always} sections.
 * Children are kept in that concatenation order; the block's own
 * when/tags/become/notify stay on this node.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class BlockNode extends TaskNode {

    private final List<TaskNode> children;

    @Builder
    public BlockNode(TaskMetadata metadata, List<TaskNode> children) {
        super(metadata);
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    @Override
    public void accept(TaskNodeVisitor visitor) {
        visitor.visit(this);
    }
}

package com.ansible.visualizer.model;

import java.util.List;
import java.util.Objects;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An {@code include_tasks} / {@code import_tasks} task together with the
 * tasks loaded from the referenced file (empty when the file was not found).
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class IncludeNode extends TaskNode {

    private final String file;
    private final List<TaskNode> included;

    @Builder
    public IncludeNode(TaskMetadata metadata, String file, List<TaskNode> included) {
        super(metadata);
        this.file = Objects.requireNonNull(file, "file");
        this.included = included != null ? List.copyOf(included) : List.of();
    }

    @Override
    public void accept(TaskNodeVisitor visitor) {
        visitor.visit(this);
    }
}

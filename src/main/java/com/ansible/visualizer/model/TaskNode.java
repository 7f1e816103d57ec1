package com.ansible.visualizer.model;

import java.util.List;
import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class for all nodes of an extracted task tree.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class TaskNode {

    protected final TaskMetadata metadata;

    protected TaskNode(TaskMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public abstract void accept(TaskNodeVisitor visitor);

    public String getName() {
        return metadata.getName();
    }

    public List<String> getWhen() {
        return metadata.getWhen();
    }

    public List<String> getTags() {
        return metadata.getTags();
    }

    public boolean isBecome() {
        return metadata.isBecome();
    }

    public String getBecomeUser() {
        return metadata.getBecomeUser();
    }

    public List<String> getNotify() {
        return metadata.getNotify();
    }
}

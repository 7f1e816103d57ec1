package com.ansible.visualizer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Normalized metadata shared by every task-tree node.
 *
 * Pure structure only: scalar-to-list normalization happens in the extractor.
 */
@Value
@Builder(toBuilder = true)
public class TaskMetadata {

    public static final String DEFAULT_NAME = "unnamed_task";

    @NonNull
    @Builder.Default
    String name = DEFAULT_NAME;

    /**
     * Conditions from {@code when}; all must hold.
     */
    @NonNull
    @Builder.Default
    List<String> when = List.of();

    @NonNull
    @Builder.Default
    List<String> tags = List.of();

    boolean become;

    /**
     * Only recorded when {@link #become} is set. May be null.
     */
    String becomeUser;

    /**
     * Handler names from {@code notify}.
     */
    @NonNull
    @Builder.Default
    List<String> notify = List.of();

    public static TaskMetadata named(String name) {
        return TaskMetadata.builder().name(name).build();
    }
}

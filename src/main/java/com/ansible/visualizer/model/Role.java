package com.ansible.visualizer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A role as found by filesystem convention: its {@code tasks/main} tree and
 * the role names listed in {@code meta/main} dependencies.
 */
@Value
@Builder
public class Role {

    @NonNull
    String name;

    @NonNull
    @Singular
    List<TaskNode> tasks;

    @NonNull
    @Singular
    List<String> dependencies;
}

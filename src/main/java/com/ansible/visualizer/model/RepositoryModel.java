package com.ansible.visualizer.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate, read-only model of everything parsed from one repository.
 *
 * All collections keep insertion order so that rendering is deterministic.
 */
@Value
public class RepositoryModel {

    Path repoRoot;

    /** Group name to directly declared hosts. */
    Map<String, List<String>> groups;

    /** Playbooks keyed by normalized path. */
    Map<Path, Playbook> playbooks;

    Set<String> roles;

    Map<String, List<TaskNode>> roleTasks;

    /** Only roles that declare at least one dependency have an entry. */
    Map<String, List<String>> roleDependencies;

    @Builder
    public RepositoryModel(Path repoRoot,
                           Map<String, List<String>> groups,
                           Map<Path, Playbook> playbooks,
                           Set<String> roles,
                           Map<String, List<TaskNode>> roleTasks,
                           Map<String, List<String>> roleDependencies) {
        this.repoRoot = repoRoot;
        this.groups = freezeListMap(groups);
        this.playbooks = playbooks != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(playbooks))
                : Map.of();
        this.roles = roles != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(roles))
                : Set.of();
        this.roleTasks = freezeListMap(roleTasks);
        this.roleDependencies = freezeListMap(roleDependencies);
    }

    public List<TaskNode> getTasksOfRole(String role) {
        return roleTasks.getOrDefault(role, List.of());
    }

    public List<String> getDependenciesOfRole(String role) {
        return roleDependencies.getOrDefault(role, List.of());
    }

    private static <T> Map<String, List<T>> freezeListMap(Map<String, List<T>> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, value != null ? List.copyOf(value) : List.of()));
        return Collections.unmodifiableMap(copy);
    }
}

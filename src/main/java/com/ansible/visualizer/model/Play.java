package com.ansible.visualizer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One host-targeted entry of a playbook.
 */
@Value
@Builder(toBuilder = true)
public class Play {

    /**
     * Host pattern copied verbatim from {@code hosts}. May be null.
     */
    String hosts;

    /**
     * Role names listed directly under {@code roles}, in order.
     */
    @NonNull
    @Singular
    List<String> roles;

    /**
     * pre_tasks ++ tasks ++ post_tasks.
     */
    @NonNull
    @Singular
    List<TaskNode> tasks;

    @NonNull
    @Singular
    List<String> handlers;

    boolean become;

    String becomeUser;

    @NonNull
    @Singular
    List<String> tags;
}

package com.ansible.visualizer.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A parsed playbook file. Identity is its normalized source path.
 */
@Value
@Builder(toBuilder = true)
public class Playbook {

    @NonNull
    Path path;

    /**
     * Display name (file name of {@link #path}).
     */
    @NonNull
    String name;

    @NonNull
    @Singular
    List<Play> plays;

    /**
     * Normalized targets of {@code import_playbook} directives that exist on disk.
     */
    @NonNull
    @Singular
    List<Path> importedPlaybooks;

    public static Playbook empty(Path path) {
        return Playbook.builder()
                .path(path)
                .name(path.getFileName().toString())
                .build();
    }
}

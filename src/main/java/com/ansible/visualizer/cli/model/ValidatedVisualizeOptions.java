package com.ansible.visualizer.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps VisualizeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedVisualizeOptions {
    Path repoRoot;
    List<Path> inventoryPaths;
    List<Path> playbookPaths;
    /** Null when writing to stdout. */
    Path outputFile;
}

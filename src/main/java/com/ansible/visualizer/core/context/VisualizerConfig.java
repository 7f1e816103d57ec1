package com.ansible.visualizer.core.context;

import java.nio.file.Path;
import java.util.List;

import com.ansible.visualizer.model.LayoutDirection;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one diagram generation run.
 */
@Data
@Builder
public class VisualizerConfig {
    private Path repoRoot;
    @Builder.Default
    private List<Path> inventoryPaths = List.of();
    @Builder.Default
    private List<Path> playbookPaths = List.of();
    @Builder.Default
    private LayoutDirection layout = LayoutDirection.LR;

    /**
     * Wrap the diagram in a Markdown {@code ```mermaid} fence.
     */
    private boolean markdown;
}

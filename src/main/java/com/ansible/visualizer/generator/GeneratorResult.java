package com.ansible.visualizer.generator;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one diagram generation run.
 */
@Data
@Builder
public class GeneratorResult {

    /**
     * Kind of fatal failure, if any.
     */
    public enum ErrorKind {
        FORMAT,
        MISSING_RESOURCE,
        INTERNAL
    }

    private boolean success;
    private String diagram;

    private String errorMessage;
    private ErrorKind errorKind;
    private Path failedPath;

    private int groupsParsed;
    private int hostsParsed;
    private int playbooksParsed;
    private int playsParsed;
    private int rolesResolved;
    private int taskNodesExtracted;
    private int diagramLines;

    @Builder.Default
    private List<String> warnings = List.of();

    public static GeneratorResult failure(ErrorKind kind, String errorMessage, Path failedPath) {
        return GeneratorResult.builder()
                .success(false)
                .errorKind(kind)
                .errorMessage(errorMessage)
                .failedPath(failedPath)
                .build();
    }
}

package com.ansible.visualizer.parser.exception;

import java.nio.file.Path;

/**
 * Base of the fatal errors raised while reading repository files.
 * Carries the offending path.
 */
public abstract class RepositoryParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    protected RepositoryParseException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

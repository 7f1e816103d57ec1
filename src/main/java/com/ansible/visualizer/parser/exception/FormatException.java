package com.ansible.visualizer.parser.exception;

import java.nio.file.Path;

/**
 * Malformed YAML or undecodable text in a playbook or inventory. Aborts the whole generation.
 */
public class FormatException extends RepositoryParseException {

    private static final long serialVersionUID = 1L;

    public FormatException(Path path, Throwable cause) {
        super("Malformed content in " + path + ": " + (cause != null ? cause.getMessage() : "unknown error"), path, cause);
    }
}

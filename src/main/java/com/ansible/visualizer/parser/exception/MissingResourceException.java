package com.ansible.visualizer.parser.exception;

import java.nio.file.Path;

/**
 * A caller-supplied inventory or playbook could not be opened.
 */
public class MissingResourceException extends RepositoryParseException {

    private static final long serialVersionUID = 1L;

    public MissingResourceException(Path path, Throwable cause) {
        super("Could not load " + path + (cause != null ? ": " + cause.getMessage() : ""), path, cause);
    }
}

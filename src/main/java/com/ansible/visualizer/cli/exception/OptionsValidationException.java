package com.ansible.visualizer.cli.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every problem found in the "visualize" options, reported together.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String describe(List<String> errors) {
        return errors.stream()
                .map(error -> "  - " + error)
                .collect(Collectors.joining(System.lineSeparator(),
                        "Invalid options (" + errors.size() + "):" + System.lineSeparator(), ""));
    }
}

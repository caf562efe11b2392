package com.graphol.index.project.exception;

import java.util.List;

/**
 * Thrown when a project configuration is rejected. The message lists one
 * problem per line; {@link #getErrors()} exposes them individually.
 */
public class ProjectConfigValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ProjectConfigValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

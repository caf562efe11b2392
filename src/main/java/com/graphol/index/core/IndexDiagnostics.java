package com.graphol.index.core;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Problems found while checking the structure of a project index.
 *
 * Pure structure only: no logging, no formatting.
 */
@Getter
public class IndexDiagnostics {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    void addError(String error) {
        errors.add(error);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }
}

package com.scaffold.generator.validation;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors and warnings produced by whole-template validation.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class Diagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

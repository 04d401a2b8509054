package com.scaffold.generator.cli.model;

import java.nio.file.Path;

import com.scaffold.generator.model.OperatingSystem;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path templatePath;
    Path normalizedOutputDir;
    OperatingSystem platform;
}

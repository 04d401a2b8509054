package com.scaffold.generator.engine;

import java.nio.file.Path;
import java.util.Map;

import com.scaffold.generator.model.OperatingSystem;
import com.scaffold.generator.resolve.LicenseTextProvider;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for one generation run.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path templatePath;

    /** Caller-supplied variable values, unvalidated. */
    @Singular
    private Map<String, Object> values;

    private Path outputDir;
    private boolean overwrite;

    /** When set, cross-validation errors abort the run; otherwise they are logged as warnings. */
    @Builder.Default
    private boolean strictValidation = true;

    @Builder.Default
    private OperatingSystem platform = OperatingSystem.current();

    @Builder.Default
    private LicenseTextProvider licenseTextProvider = LicenseTextProvider.NONE;
}

package com.scaffold.generator.resolve;

import com.scaffold.generator.model.TemplateMetadata;

/**
 * Supplies the {@code license_text} system variable for a template.
 */
@FunctionalInterface
public interface LicenseTextProvider {

    /** Provides no license text. */
    LicenseTextProvider NONE = metadata -> "";

    String licenseText(TemplateMetadata metadata);
}

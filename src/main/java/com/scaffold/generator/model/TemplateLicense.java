package com.scaffold.generator.model;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Licenses a template may be published under.
 */
public enum TemplateLicense {
    MIT("MIT"),
    APACHE_2_0("Apache-2.0"),
    GPL_3_0("GPL-3.0"),
    BSD_3_CLAUSE("BSD-3-Clause"),
    UNLICENSE("Unlicense"),
    PROPRIETARY("Proprietary");

    private final String value;

    TemplateLicense(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TemplateLicense fromValue(String value) {
        return Arrays.stream(values())
                .filter(l -> l.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("license",
                        "invalid license '" + value + "', must be one of: "
                                + Arrays.stream(values()).map(TemplateLicense::getValue).collect(Collectors.joining(", "))));
    }
}

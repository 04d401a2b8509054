package com.scaffold.generator.resolve;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.model.TemplateMetadata;

import lombok.Builder;
import lombok.Value;

/**
 * Variables injected by the generator into every rendering. They cannot be
 * overridden by user values.
 */
@Value
@Builder
public class SystemVariables {
    private static final Logger log = LoggerFactory.getLogger(SystemVariables.class);

    public static final String CURRENT_YEAR = "current_year";
    public static final String CURRENT_DATE = "current_date";
    public static final String GENERATOR_NAME = "generator_name";
    public static final String GENERATOR_VERSION = "generator_version";
    public static final String LICENSE_TEXT = "license_text";

    public static final Set<String> NAMES = Set.of(
            CURRENT_YEAR, CURRENT_DATE, GENERATOR_NAME, GENERATOR_VERSION, LICENSE_TEXT);

    public static final String DEFAULT_GENERATOR_NAME = "scaffold-generator";

    LocalDate currentDate;
    String generatorName;
    String generatorVersion;
    String licenseText;

    public static SystemVariables forTemplate(TemplateMetadata metadata, LicenseTextProvider licenseTextProvider,
                                              Clock clock) {
        return SystemVariables.builder()
                .currentDate(LocalDate.now(clock))
                .generatorName(DEFAULT_GENERATOR_NAME)
                .generatorVersion(generatorVersion())
                .licenseText(licenseTextProvider.licenseText(metadata))
                .build();
    }

    public static boolean isSystemVariable(String name) {
        return NAMES.contains(name);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(CURRENT_YEAR, currentDate.getYear());
        values.put(CURRENT_DATE, currentDate.toString());
        values.put(GENERATOR_NAME, generatorName);
        values.put(GENERATOR_VERSION, generatorVersion);
        values.put(LICENSE_TEXT, licenseText == null ? "" : licenseText);
        return values;
    }

    /**
     * Resolved variables plus the system variables, the latter taking precedence.
     */
    public Map<String, Object> mergeInto(Map<String, Object> resolved) {
        Map<String, Object> merged = new LinkedHashMap<>(resolved);
        for (Map.Entry<String, Object> entry : asMap().entrySet()) {
            if (resolved.containsKey(entry.getKey())) {
                log.warn("Ignoring user value for system variable '{}'", entry.getKey());
            }
            merged.put(entry.getKey(), entry.getValue());
        }
        return merged;
    }

    private static String generatorVersion() {
        String version = SystemVariables.class.getPackage().getImplementationVersion();
        return version != null ? version : "1.0.0";
    }
}

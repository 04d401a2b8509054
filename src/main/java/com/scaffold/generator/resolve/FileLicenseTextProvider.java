package com.scaffold.generator.resolve;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.exception.TemplateLoadException;
import com.scaffold.generator.model.TemplateMetadata;

/**
 * Reads license text from a file. The file is read on every call, so edits are picked up.
 */
public class FileLicenseTextProvider implements LicenseTextProvider {
    private static final Logger log = LoggerFactory.getLogger(FileLicenseTextProvider.class);

    private final Path licenseFile;

    public FileLicenseTextProvider(Path licenseFile) {
        this.licenseFile = licenseFile;
    }

    @Override
    public String licenseText(TemplateMetadata metadata) {
        try {
            String text = Files.readString(licenseFile, StandardCharsets.UTF_8);
            log.debug("Loaded {} license text from {}", metadata.getLicense().getValue(), licenseFile);
            return text;
        } catch (IOException e) {
            throw new TemplateLoadException("Cannot read license file " + licenseFile + ": " + e.getMessage(), e);
        }
    }
}

package com.scaffold.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.scaffold.generator.cli.exception.OptionsValidationException;
import com.scaffold.generator.cli.model.GenerateOptions;
import com.scaffold.generator.cli.model.ValidatedGenerateOptions;
import com.scaffold.generator.model.OperatingSystem;
import com.scaffold.generator.parser.TemplateLoader;
import com.scaffold.generator.util.FileWriteUtil;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path templatePath = o.getTemplatePath();
		if (templatePath == null) {
			errors.add("Template file is required (--template / -t).");
		} else if (!Files.isRegularFile(templatePath)) {
			errors.add("Template file does not exist or is not a file: " + templatePath);
		} else if (!TemplateLoader.isDefinitionFile(templatePath)) {
			errors.add("Template file must be .yaml, .yml or .json: " + templatePath);
		}

		if (o.getValuesFile() != null && !Files.isRegularFile(o.getValuesFile())) {
			errors.add("Values file does not exist: " + o.getValuesFile());
		}
		if (o.getLicenseFile() != null && !Files.isRegularFile(o.getLicenseFile())) {
			errors.add("License file does not exist: " + o.getLicenseFile());
		}

		for (String name : o.getInlineValues().keySet()) {
			if (isBlank(name)) {
				errors.add("--set requires name=value, got an empty name.");
			}
		}

		// Normalize output dir
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		} else if (!o.isOverwrite() && isNonEmpty(normalizedOutputDir)) {
			errors.add("Output directory is not empty: " + normalizedOutputDir + ". Use --overwrite to write into it.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		OperatingSystem platform = o.getPlatform() != null ? o.getPlatform() : OperatingSystem.current();
		return new ValidatedGenerateOptions(templatePath.toAbsolutePath().normalize(), normalizedOutputDir, platform);
	}

	private static boolean isNonEmpty(Path dir) {
		try {
			return FileWriteUtil.isNonEmptyDirectory(dir);
		} catch (IOException e) {
			return true;
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}

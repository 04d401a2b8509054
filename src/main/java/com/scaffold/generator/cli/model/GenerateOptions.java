package com.scaffold.generator.cli.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.scaffold.generator.model.OperatingSystem;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--template", "-t" }, required = true, description = "Template definition file (.yaml, .yml or .json)")
	private Path templatePath;

	@Option(names = { "--output-dir", "-o" }, description = "Directory to generate into (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--values", "-f" }, description = "YAML or JSON file with variable values")
	private Path valuesFile;

	@Option(names = { "--set", "-s" }, description = "Variable value as name=value; overrides the values file (repeatable)")
	private Map<String, String> inlineValues = new LinkedHashMap<>();

	@Option(names = { "--overwrite" }, description = "Write into a non-empty output directory, replacing existing files")
	private boolean overwrite;

	@Option(names = { "--lenient" }, description = "Continue when template validation reports errors")
	private boolean lenient;

	@Option(names = { "--platform" }, description = "Platform used to select actions: ${COMPLETION-CANDIDATES} (defaults to the current OS)")
	private OperatingSystem platform;

	@Option(names = { "--license-file" }, description = "File whose content becomes the license_text variable")
	private Path licenseFile;
}

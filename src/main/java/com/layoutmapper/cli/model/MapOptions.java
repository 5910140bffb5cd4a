package com.layoutmapper.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "map" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class MapOptions {

	@Option(names = { "--layout", "-l" }, required = true, description = "Layout document JSON (design-tool file or node export)")
	private Path layoutFile;

	@Option(names = { "--catalog", "-c" }, required = true, description = "Component catalog JSON")
	private Path catalogFile;

	@Option(names = { "--min-confidence" }, defaultValue = "60", description = "Minimum confidence (0-100) for a mapping (default: ${DEFAULT-VALUE})")
	private double minConfidence;

	@Option(names = { "--library-root" }, defaultValue = "@skbkontur/react-ui", description = "Module root for components without an import path (default: ${DEFAULT-VALUE})")
	private String libraryRoot;

	@Option(names = { "--suggestions" }, defaultValue = "3", description = "Maximum suggestions per unmapped element (default: ${DEFAULT-VALUE})")
	private int suggestionLimit;

	@Option(names = { "--parallel-threshold" }, defaultValue = "0", description = "Score in parallel from this many mappable elements; 0 disables (default: ${DEFAULT-VALUE})")
	private int parallelThreshold;

	@Option(names = { "--no-imports" }, description = "Leave import statements out of the generated code")
	private boolean noImports;

	@Option(names = { "--no-interfaces" }, description = "Skip the TypeScript props interfaces")
	private boolean noInterfaces;

	@Option(names = { "--output-dir", "-o" }, description = "Write GeneratedComponent.tsx and ComponentProps.ts to this directory")
	private Path outputDir;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing generated files")
	private boolean force;
}

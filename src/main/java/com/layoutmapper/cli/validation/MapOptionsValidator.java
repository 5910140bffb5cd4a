package com.layoutmapper.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.layoutmapper.cli.exception.OptionsValidationException;
import com.layoutmapper.cli.model.MapOptions;
import com.layoutmapper.cli.model.ValidatedMapOptions;
import com.layoutmapper.engine.EngineConfig;

public class MapOptionsValidator {

	public static final String SCAFFOLD_FILE_NAME = "GeneratedComponent.tsx";
	public static final String INTERFACES_FILE_NAME = "ComponentProps.ts";

	public ValidatedMapOptions validate(MapOptions o) {
		List<String> errors = new ArrayList<>();

		checkReadableFile(o.getLayoutFile(), "Layout file", "--layout / -l", errors);
		checkReadableFile(o.getCatalogFile(), "Catalog file", "--catalog / -c", errors);

		if (Double.isNaN(o.getMinConfidence()) || o.getMinConfidence() < 0 || o.getMinConfidence() > 100) {
			errors.add("Minimum confidence must be in range 0-100. Got: " + o.getMinConfidence());
		}
		if (o.getSuggestionLimit() < 0) {
			errors.add("Suggestion limit must be >= 0. Got: " + o.getSuggestionLimit());
		}
		if (o.getParallelThreshold() < 0) {
			errors.add("Parallel threshold must be >= 0. Got: " + o.getParallelThreshold());
		}

		Path normalizedOutputDir = null;
		Path scaffoldFile = null;
		Path interfacesFile = null;
		if (o.getOutputDir() != null) {
			normalizedOutputDir = o.getOutputDir().toAbsolutePath().normalize();
			scaffoldFile = normalizedOutputDir.resolve(SCAFFOLD_FILE_NAME);
			interfacesFile = normalizedOutputDir.resolve(INTERFACES_FILE_NAME);

			if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
				errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
			} else if (!o.isForce()) {
				for (Path target : List.of(scaffoldFile, interfacesFile)) {
					if (Files.exists(target)) {
						errors.add("Output file already exists: " + target + ". Use --force to overwrite.");
					}
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		EngineConfig config = EngineConfig.builder()
				.minConfidence(o.getMinConfidence())
				.includeImports(!o.isNoImports())
				.includeTypeInterfaces(!o.isNoInterfaces())
				.suggestionLimit(o.getSuggestionLimit())
				.parallelThreshold(o.getParallelThreshold())
				.libraryRoot(o.getLibraryRoot())
				.build();

		return new ValidatedMapOptions(config, normalizedOutputDir, scaffoldFile, interfacesFile);
	}

	static void checkReadableFile(Path p, String label, String option, List<String> errors) {
		if (p == null) {
			errors.add(label + " is required (" + option + ").");
		} else if (!Files.exists(p)) {
			errors.add(label + " does not exist: " + p);
		} else if (!Files.isRegularFile(p)) {
			errors.add(label + " is not a regular file: " + p);
		}
	}
}

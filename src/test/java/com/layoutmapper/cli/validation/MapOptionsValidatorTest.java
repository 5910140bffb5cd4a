package com.layoutmapper.cli.validation;

import com.layoutmapper.cli.exception.OptionsValidationException;
import com.layoutmapper.cli.model.MapOptions;
import com.layoutmapper.cli.model.ValidatedMapOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class MapOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final MapOptionsValidator validator = new MapOptionsValidator();

    private Path layout;
    private Path catalog;

    @BeforeEach
    void setUp() throws IOException {
        layout = Files.writeString(tempDir.resolve("layout.json"), "{}");
        catalog = Files.writeString(tempDir.resolve("catalog.json"), "[]");
    }

    @Test
    void testValidOptionsBuildEngineConfig() {
        ValidatedMapOptions validated = validator.validate(options(
                "-l", layout.toString(), "-c", catalog.toString(),
                "--min-confidence", "45", "--no-imports", "--suggestions", "5"));

        assertThat(validated.isWritingFiles()).isFalse();
        assertThat(validated.getEngineConfig().getMinConfidence()).isEqualTo(45.0);
        assertThat(validated.getEngineConfig().isIncludeImports()).isFalse();
        assertThat(validated.getEngineConfig().isIncludeTypeInterfaces()).isTrue();
        assertThat(validated.getEngineConfig().getSuggestionLimit()).isEqualTo(5);
        assertThat(validated.getEngineConfig().getLibraryRoot()).isEqualTo("@skbkontur/react-ui");
    }

    @Test
    void testOutputDirResolvesTargetFiles() {
        Path out = tempDir.resolve("out");

        ValidatedMapOptions validated = validator.validate(options(
                "-l", layout.toString(), "-c", catalog.toString(), "-o", out.toString()));

        assertThat(validated.isWritingFiles()).isTrue();
        assertThat(validated.getScaffoldFile()).isEqualTo(out.toAbsolutePath().normalize().resolve("GeneratedComponent.tsx"));
        assertThat(validated.getInterfacesFile().getFileName().toString()).isEqualTo("ComponentProps.ts");
    }

    @Test
    void testAllErrorsAreCollected() {
        MapOptions options = options(
                "-l", tempDir.resolve("missing.json").toString(),
                "-c", tempDir.toString(),
                "--min-confidence", "120",
                "--suggestions", "-1");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(4)
                        .anySatisfy(err -> assertThat(err).startsWith("Layout file does not exist"))
                        .anySatisfy(err -> assertThat(err).startsWith("Catalog file is not a regular file"))
                        .anySatisfy(err -> assertThat(err).startsWith("Minimum confidence must be in range 0-100"))
                        .anySatisfy(err -> assertThat(err).startsWith("Suggestion limit must be >= 0")));
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve(MapOptionsValidator.SCAFFOLD_FILE_NAME), "old");

        assertThatThrownBy(() -> validator.validate(options(
                "-l", layout.toString(), "-c", catalog.toString(), "-o", out.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");

        assertThat(validator.validate(options(
                "-l", layout.toString(), "-c", catalog.toString(), "-o", out.toString(), "--force"))
                .isWritingFiles()).isTrue();
    }

    @Test
    void testOutputPathMustBeDirectory() {
        assertThatThrownBy(() -> validator.validate(options(
                "-l", layout.toString(), "-c", catalog.toString(), "-o", layout.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("not a directory");
    }

    private static MapOptions options(String... args) {
        return CommandLine.populateCommand(new MapOptions(), args);
    }
}

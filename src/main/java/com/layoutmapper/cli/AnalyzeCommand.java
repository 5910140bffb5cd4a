package com.layoutmapper.cli;

import com.layoutmapper.cli.exception.OptionsValidationException;
import com.layoutmapper.cli.output.ReportPrinter;
import com.layoutmapper.codegen.util.FileWriteUtil;
import com.layoutmapper.engine.LayoutDigest;
import com.layoutmapper.engine.LayoutMappingEngine;
import com.layoutmapper.model.LayoutDocument;
import com.layoutmapper.parser.LayoutDocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints the structure, style and pattern digest of a layout document.
 */
@Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        description = "Extracts styles, layout patterns and metrics from a layout document."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Option(names = {"--layout", "-l"}, required = true, description = "Layout document JSON")
    private Path layoutFile;

    @Option(names = {"--css-output"}, description = "Write the extracted colors as CSS variables to this file")
    private Path cssOutput;

    @Option(names = {"--force", "-f"}, description = "Overwrite an existing CSS output file")
    private boolean force;

    private final ReportPrinter printer = new ReportPrinter();
    private final LayoutMappingEngine engine = new LayoutMappingEngine();

    @Override
    public Integer call() {
        try {
            validate();

            LayoutDocument layout = new LayoutDocumentParser().parse(layoutFile);
            layout.getWarnings().forEach(w -> log.warn("Layout: {}", w));

            LayoutDigest digest = engine.digest(layout.getRoot());
            printer.printDigest(layout.getName(), digest);

            if (cssOutput != null) {
                String css = digest.getStyles().toCssVariables() + System.lineSeparator();
                if (!FileWriteUtil.writeIfAllowed(cssOutput, css, force)) {
                    log.error("CSS output file already exists: {}. Use --force to overwrite.", cssOutput);
                    return 1;
                }
                printer.printWrittenFile(cssOutput.toAbsolutePath());
            }
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        } catch (Exception e) {
            log.error("Analysis failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void validate() {
        List<String> errors = new ArrayList<>();
        if (layoutFile == null || !Files.isRegularFile(layoutFile)) {
            errors.add("Layout file does not exist or is not a regular file: " + layoutFile);
        }
        if (cssOutput != null && Files.isDirectory(cssOutput)) {
            errors.add("CSS output path is a directory: " + cssOutput);
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
    }
}

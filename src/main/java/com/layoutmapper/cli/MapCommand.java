package com.layoutmapper.cli;

import com.layoutmapper.catalog.Catalog;
import com.layoutmapper.catalog.CatalogDocument;
import com.layoutmapper.catalog.CatalogIndexer;
import com.layoutmapper.cli.exception.OptionsValidationException;
import com.layoutmapper.cli.model.MapOptions;
import com.layoutmapper.cli.model.ValidatedMapOptions;
import com.layoutmapper.cli.output.ReportPrinter;
import com.layoutmapper.cli.validation.MapOptionsValidator;
import com.layoutmapper.codegen.GeneratedCode;
import com.layoutmapper.codegen.util.FileWriteUtil;
import com.layoutmapper.engine.LayoutMappingEngine;
import com.layoutmapper.engine.MappingResult;
import com.layoutmapper.model.LayoutDocument;
import com.layoutmapper.parser.CatalogParser;
import com.layoutmapper.parser.LayoutDocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Maps a layout document onto a component catalog and prints (or writes) the generated code.
 */
@Command(
        name = "map",
        mixinStandardHelpOptions = true,
        description = "Maps layout elements to catalog components and generates scaffold code."
)
public class MapCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MapCommand.class);

    @Mixin
    private MapOptions options = new MapOptions();

    private final MapOptionsValidator validator = new MapOptionsValidator();
    private final ReportPrinter printer = new ReportPrinter();
    private final LayoutMappingEngine engine = new LayoutMappingEngine();

    @Override
    public Integer call() {
        try {
            ValidatedMapOptions validated = validator.validate(options);
            printer.printMapBanner(options, validated);

            LayoutDocument layout = new LayoutDocumentParser().parse(options.getLayoutFile());
            layout.getWarnings().forEach(w -> log.warn("Layout: {}", w));

            CatalogDocument catalogDoc = new CatalogParser().parse(options.getCatalogFile());
            Catalog catalog = new CatalogIndexer().buildIndex(catalogDoc.getComponents(), catalogDoc.getErrors());
            catalog.getWarnings().forEach(w -> log.warn("Catalog: {}", w));

            MappingResult result = engine.mapLayout(layout.getRoot(), catalog, validated.getEngineConfig());
            printer.printMappingResult(result);

            if (validated.isWritingFiles()) {
                writeOutputs(result.getCode(), validated);
            }
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        } catch (Exception e) {
            log.error("Mapping failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void writeOutputs(GeneratedCode code, ValidatedMapOptions validated) throws IOException {
        if (code.hasScaffold()) {
            FileWriteUtil.safeWriteString(validated.getScaffoldFile(), code.getScaffold() + System.lineSeparator());
            printer.printWrittenFile(validated.getScaffoldFile());
        } else {
            log.warn("Nothing was mapped; {} not written", validated.getScaffoldFile().getFileName());
        }
        if (!code.getTypeInterfaces().isEmpty()) {
            String interfaces = String.join(System.lineSeparator() + System.lineSeparator(), code.getTypeInterfaces());
            FileWriteUtil.safeWriteString(validated.getInterfacesFile(), interfaces + System.lineSeparator());
            printer.printWrittenFile(validated.getInterfacesFile());
        }
    }
}

package com.layoutmapper.codegen;

import com.layoutmapper.codegen.util.ImportManager;
import com.layoutmapper.mapping.Mapping;
import com.layoutmapper.mapping.MappingReport;
import com.layoutmapper.mapping.PropBindingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the accepted mappings of a report into imports, usage lines, props interfaces
 * and a composed scaffold component.
 */
public class CodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    private final TypeInterfaceGenerator interfaceGenerator;
    private final ScaffoldRenderer scaffoldRenderer;

    public CodeGenerator() {
        this(new TypeInterfaceGenerator(), new ScaffoldRenderer());
    }

    public CodeGenerator(TypeInterfaceGenerator interfaceGenerator, ScaffoldRenderer scaffoldRenderer) {
        this.interfaceGenerator = interfaceGenerator;
        this.scaffoldRenderer = scaffoldRenderer;
    }

    public GeneratedCode generate(MappingReport report, CodegenOptions options) {
        Map<String, List<Mapping>> groups = report.mappingsByComponent();
        GeneratedCode.GeneratedCodeBuilder code = GeneratedCode.builder().totalComponents(groups.size());

        ImportManager importManager = new ImportManager();
        List<String> usageLines = new ArrayList<>();

        for (Map.Entry<String, List<Mapping>> group : groups.entrySet()) {
            List<Mapping> mappings = group.getValue();
            importManager.addImport(mappings.get(0).getImportPath(), group.getKey());

            for (Mapping mapping : mappings) {
                code.usage(new ComponentUsage(
                        mapping.getElement().getId(),
                        mapping.getElement().getName(),
                        mapping.getComponentName(),
                        mapping.getExampleUsage(),
                        mapping.getPropsBinding()));
                usageLines.add(mapping.getExampleUsage());
                collectWarnings(mapping, code);
            }

            if (options.isIncludeTypeInterfaces()) {
                code.typeInterface(interfaceGenerator.generate(mappings.get(0).getComponent()));
            }
        }

        List<String> imports = options.isIncludeImports() ? importManager.generateImports() : List.of();
        code.imports(imports);
        code.scaffold(usageLines.isEmpty() ? "" : scaffoldRenderer.render(imports, usageLines));

        GeneratedCode result = code.build();
        log.debug("Generated {} usages of {} components ({} imports, {} interfaces)",
                result.getTotalUsages(), result.getTotalComponents(),
                result.getImports().size(), result.getTypeInterfaces().size());
        return result;
    }

    private void collectWarnings(Mapping mapping, GeneratedCode.GeneratedCodeBuilder code) {
        for (String note : mapping.getNotes()) {
            if (!PropBindingResolver.INSTANCE_NOTE.equals(note)) {
                code.warning(mapping.getElement().getName() + ": " + note);
            }
        }
    }
}

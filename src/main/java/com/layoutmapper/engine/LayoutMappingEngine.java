package com.layoutmapper.engine;

import com.layoutmapper.analysis.ComponentInventory;
import com.layoutmapper.analysis.ComponentInventoryCollector;
import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.analysis.LayoutAnalysis;
import com.layoutmapper.analysis.PatternAnalyzer;
import com.layoutmapper.analysis.StyleDigest;
import com.layoutmapper.analysis.StyleExtractor;
import com.layoutmapper.analysis.TreeFlattener;
import com.layoutmapper.catalog.Catalog;
import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.CatalogIndexer;
import com.layoutmapper.catalog.DesignSystemCatalogBuilder;
import com.layoutmapper.codegen.CodeGenerator;
import com.layoutmapper.codegen.CodegenOptions;
import com.layoutmapper.codegen.GeneratedCode;
import com.layoutmapper.mapping.ImportPathResolver;
import com.layoutmapper.mapping.Mapper;
import com.layoutmapper.mapping.MappingReport;
import com.layoutmapper.mapping.PropBindingResolver;
import com.layoutmapper.mapping.SimilarityScorer;
import com.layoutmapper.model.LayoutNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Library entry point. Every call works on the inputs it is given and keeps no state,
 * so one instance can serve concurrent callers.
 */
public class LayoutMappingEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutMappingEngine.class);

    private final StyleExtractor styleExtractor = new StyleExtractor();
    private final TreeFlattener treeFlattener = new TreeFlattener();
    private final PatternAnalyzer patternAnalyzer = new PatternAnalyzer();
    private final ComponentInventoryCollector inventoryCollector = new ComponentInventoryCollector();
    private final CatalogIndexer catalogIndexer = new CatalogIndexer();
    private final DesignSystemCatalogBuilder designSystemBuilder = new DesignSystemCatalogBuilder();
    private final SimilarityScorer scorer = new SimilarityScorer();
    private final PropBindingResolver bindingResolver = new PropBindingResolver();
    private final CodeGenerator codeGenerator = new CodeGenerator();

    public StyleDigest extractStyles(LayoutNode root) {
        return styleExtractor.extractStyles(root);
    }

    public List<FlatElement> flatten(LayoutNode root) {
        return treeFlattener.flatten(root);
    }

    public LayoutAnalysis analyzeLayout(LayoutNode root) {
        return patternAnalyzer.analyzeLayout(root);
    }

    public ComponentInventory collectComponents(LayoutNode root) {
        return inventoryCollector.collect(root);
    }

    public Catalog buildIndex(List<CatalogComponent> components) {
        return catalogIndexer.buildIndex(components);
    }

    /**
     * Catalog built from the main components of a design-system tree.
     */
    public Catalog buildIndex(LayoutNode designSystem) {
        return buildIndex(designSystemBuilder.extractComponents(designSystem));
    }

    public double score(FlatElement element, CatalogComponent component) {
        return scorer.score(element, component);
    }

    public MappingReport map(List<FlatElement> elements, Catalog catalog, double minConfidence) {
        return map(elements, catalog, EngineConfig.builder().minConfidence(minConfidence).build());
    }

    public MappingReport map(List<FlatElement> elements, Catalog catalog, EngineConfig config) {
        config.validate();
        return mapperFor(config).map(elements, catalog, config.getMinConfidence());
    }

    public GeneratedCode generate(MappingReport report, CodegenOptions options) {
        return codeGenerator.generate(report, options);
    }

    /**
     * Flattening, style extraction, pattern analysis and component inventory of one tree.
     */
    public LayoutDigest digest(LayoutNode root) {
        return LayoutDigest.builder()
                .elements(flatten(root))
                .styles(extractStyles(root))
                .analysis(analyzeLayout(root))
                .inventory(collectComponents(root))
                .build();
    }

    /**
     * Full pipeline: flatten the tree, map against the catalog and generate code.
     * The configuration is validated before any work starts.
     */
    public MappingResult mapLayout(LayoutNode root, Catalog catalog, EngineConfig config) {
        config.validate();
        List<FlatElement> elements = flatten(root);
        MappingReport report = map(elements, catalog, config);
        GeneratedCode code = generate(report, config.toCodegenOptions());
        log.info("Mapped layout '{}': {} mappings, {} unmapped, {} usages generated",
                root == null ? "" : root.getName(), report.getMappings().size(),
                report.getUnmappedElements().size(), code.getTotalUsages());
        return new MappingResult(report, code);
    }

    private Mapper mapperFor(EngineConfig config) {
        return new Mapper(scorer, bindingResolver, new ImportPathResolver(config.getLibraryRoot()),
                config.getSuggestionLimit(), config.getSuggestionFloor(), config.getParallelThreshold());
    }
}

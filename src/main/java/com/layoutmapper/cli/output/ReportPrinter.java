package com.layoutmapper.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutmapper.analysis.ComponentInstance;
import com.layoutmapper.analysis.ComponentInventory;
import com.layoutmapper.analysis.ContainerPattern;
import com.layoutmapper.analysis.LayoutMetrics;
import com.layoutmapper.analysis.StyleDigest;
import com.layoutmapper.cli.model.MapOptions;
import com.layoutmapper.cli.model.ValidatedMapOptions;
import com.layoutmapper.engine.LayoutDigest;
import com.layoutmapper.engine.MappingResult;
import com.layoutmapper.mapping.Mapping;
import com.layoutmapper.mapping.MappingStatistics;
import com.layoutmapper.mapping.Recommendation;
import com.layoutmapper.mapping.Suggestion;
import com.layoutmapper.mapping.UnmappedElement;
import com.layoutmapper.util.FormatUtil;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class ReportPrinter {

    private static final Logger log = LoggerFactory.getLogger(ReportPrinter.class);

    private static final String RULE = "=================================================";

    public void printMapBanner(MapOptions o, ValidatedMapOptions v) {
        log.info(RULE);
        log.info("Layout Mapper");
        log.info(RULE);
        log.info("Layout File: {}", o.getLayoutFile().toAbsolutePath());
        log.info("Catalog File: {}", o.getCatalogFile().toAbsolutePath());
        log.info("Min Confidence: {}", FormatUtil.compact(o.getMinConfidence()));
        log.info("Library Root: {}", v.getEngineConfig().getLibraryRoot());
        log.info("Output Directory: {}", v.isWritingFiles() ? v.getNormalizedOutputDir() : "None (console only)");
        log.info(RULE);
    }

    public void printMappingResult(MappingResult result) {
        MappingStatistics stats = result.getReport().getStatistics();

        log.info("");
        log.info(RULE);
        log.info("MAPPING RESULTS");
        log.info(RULE);
        log.info("Elements: {} total, {} mappable", stats.getTotalElements(), stats.getMappableElements());
        log.info("Mapped: {} ({}%)", stats.getMappedCount(), FormatUtil.compact(stats.getSuccessRatePercent()));
        log.info("Average Confidence: {}", FormatUtil.compact(stats.getAverageConfidence()));
        log.info("Confidence: high={} medium={} low={}",
                stats.getConfidenceHistogram().get("high"),
                stats.getConfidenceHistogram().get("medium"),
                stats.getConfidenceHistogram().get("low"));
        log.info("Catalog Coverage: {}%", FormatUtil.compact(stats.getCatalogCoveragePercent()));

        if (!result.getReport().getMappings().isEmpty()) {
            log.info("");
            log.info("Mappings:");
            for (Mapping mapping : result.getReport().getMappings()) {
                log.info("  {} -> {} ({})", mapping.getElement().getPath(), mapping.getComponentName(),
                        FormatUtil.compact(mapping.getConfidence()));
                log.info("      {}", mapping.getExampleUsage());
            }
        }

        if (!result.getReport().getUnmappedElements().isEmpty()) {
            log.info("");
            log.info("Unmapped:");
            for (UnmappedElement unmapped : result.getReport().getUnmappedElements()) {
                log.info("  {} [{}] best={} - {}", unmapped.getElement().getPath(),
                        unmapped.getElement().getTypeLabel(),
                        FormatUtil.compact(unmapped.getBestScore()), unmapped.getReason());
                for (Suggestion suggestion : unmapped.getSuggestions()) {
                    log.info("      try {} ({}): {}", suggestion.getComponentName(),
                            FormatUtil.compact(suggestion.getScore()), suggestion.getReason());
                }
            }
        }

        printList("Recommendations:", result.getReport().getRecommendations().stream()
                .map(Recommendation::getMessage).toList());
        printList("Catalog Errors:", result.getReport().getErrors());
        printList("Code Warnings:", result.getCode().getWarnings());

        if (result.getCode().hasScaffold()) {
            log.info("");
            log.info("Generated Scaffold:");
            result.getCode().getScaffold().lines().forEach(line -> log.info("  {}", line));
        }
        log.info(RULE);
    }

    public void printDigest(String layoutName, LayoutDigest digest) {
        StyleDigest styles = digest.getStyles();
        LayoutMetrics metrics = digest.getAnalysis().getMetrics();

        log.info(RULE);
        log.info("LAYOUT ANALYSIS: {}", layoutName);
        log.info(RULE);
        log.info("Nodes: {} (max depth {}, {} mappable)", metrics.getTotalNodes(), metrics.getMaxDepth(),
                digest.getMappableCount());
        log.info("Containers: {} (avg {} children)", metrics.getContainerCount(),
                FormatUtil.compact(metrics.getAverageChildren()));
        log.info("Text Density: {}  Component Density: {}", FormatUtil.compact(metrics.getTextDensity()),
                FormatUtil.compact(metrics.getComponentDensity()));
        log.info("Types: {}", metrics.getTypeDistribution());

        log.info("");
        log.info("Styles: {} colors, {} text styles, {} shadows, {} layers", styles.getColors().size(),
                styles.getTextStyles().size(), styles.getEffects().size(), styles.getLayerCount());
        printCategories("Color Groups:", styles.getColorCategories());
        styles.getTextStyles().forEach(t -> log.info("  [{}] {}", t.getCategory().label(), t.describe()));

        printPatterns("Spacing Patterns:", digest.getAnalysis().getSpacingPatterns());
        printPatterns("Alignment Patterns:", digest.getAnalysis().getAlignmentPatterns());
        printPatterns("Responsive Patterns:", digest.getAnalysis().getResponsivePatterns());
        if (!digest.getAnalysis().getGrids().isEmpty()) {
            log.info("Layout Grids: {}", digest.getAnalysis().getGrids().size());
        }
        printInventory(digest.getInventory());
        log.info(RULE);
    }

    public void printWrittenFile(Path file) {
        log.info("Wrote {}", file);
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  - {}", e));
    }

    private void printInventory(ComponentInventory inventory) {
        if (inventory == null || inventory.getInstances().isEmpty() && inventory.getComponents().isEmpty()) {
            return;
        }
        log.info("");
        log.info("Components: {}", inventory.getTypeCounts());
        for (ComponentInstance instance : inventory.getInstances()) {
            log.info("  {} -> {} ({} overrides)", instance.getName(),
                    instance.isResolved() ? instance.getComponentName() : "unresolved " + instance.getComponentId(),
                    instance.getPropertyOverrides().size() + instance.getOverrides().size());
        }
    }

    private void printPatterns(String title, List<ContainerPattern> patterns) {
        if (patterns.isEmpty()) {
            return;
        }
        log.info("");
        log.info(title);
        patterns.forEach(p -> log.info("  {}: {}", p.getNodeName(), p.getPattern()));
    }

    private void printCategories(String title, Map<String, List<String>> categories) {
        if (categories.isEmpty()) {
            return;
        }
        log.info(title);
        categories.forEach((category, values) -> log.info("  {}: {}", category, String.join(", ", values)));
    }

    private void printList(String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        log.info("");
        log.info(title);
        lines.forEach(line -> log.info("  - {}", line));
    }
}

package com.layoutmapper.mapping;

import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.catalog.Catalog;
import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.util.FormatUtil;
import com.layoutmapper.util.JsxFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.IntStream;

/**
 * Assigns each mappable element the best scoring catalog component.
 *
 * Ties go to the component that comes first in catalog order. Elements whose best
 * score stays below the floor become {@link UnmappedElement}s with ranked suggestions.
 * Above {@code parallelThreshold} mappable elements, scoring runs on the common
 * fork-join pool; results are still reported in element order.
 */
public class Mapper {
    private static final Logger log = LoggerFactory.getLogger(Mapper.class);

    public static final int DEFAULT_SUGGESTION_LIMIT = 3;
    public static final double DEFAULT_SUGGESTION_FLOOR = 30.0;

    private final SimilarityScorer scorer;
    private final PropBindingResolver bindingResolver;
    private final ImportPathResolver importPathResolver;
    private final MappingSummarizer summarizer;
    private final int suggestionLimit;
    private final double suggestionFloor;
    private final int parallelThreshold;

    public Mapper() {
        this(new SimilarityScorer(), new PropBindingResolver(), new ImportPathResolver(),
                DEFAULT_SUGGESTION_LIMIT, DEFAULT_SUGGESTION_FLOOR, 0);
    }

    /**
     * @param parallelThreshold minimum number of mappable elements for parallel scoring; 0 disables it
     */
    public Mapper(SimilarityScorer scorer, PropBindingResolver bindingResolver,
                  ImportPathResolver importPathResolver, int suggestionLimit,
                  double suggestionFloor, int parallelThreshold) {
        this.scorer = scorer;
        this.bindingResolver = bindingResolver;
        this.importPathResolver = importPathResolver;
        this.summarizer = new MappingSummarizer();
        this.suggestionLimit = suggestionLimit;
        this.suggestionFloor = suggestionFloor;
        this.parallelThreshold = parallelThreshold;
    }

    public MappingReport map(List<FlatElement> elements, Catalog catalog, double minConfidence) {
        validateMinConfidence(minConfidence);

        List<FlatElement> mappable = elements.stream()
                .filter(FlatElement::isMappable)
                .toList();
        List<CatalogComponent> components = catalog.getComponents();
        log.info("Mapping {} mappable elements (of {}) against {} components, min confidence {}",
                mappable.size(), elements.size(), components.size(), FormatUtil.compact(minConfidence));

        boolean parallel = parallelThreshold > 0 && mappable.size() >= parallelThreshold;
        IntStream indices = IntStream.range(0, mappable.size());
        if (parallel) {
            log.debug("Scoring in parallel ({} >= threshold {})", mappable.size(), parallelThreshold);
            indices = indices.parallel();
        }
        List<Outcome> outcomes = new ArrayList<>(indices
                .mapToObj(i -> resolve(mappable.get(i), components, minConfidence))
                .toList());
        outcomes.sort(Comparator.comparingInt(o -> o.element().getIndex()));

        MappingReport.MappingReportBuilder report = MappingReport.builder()
                .minConfidence(minConfidence)
                .errors(catalog.getErrors());
        List<Mapping> mappings = new ArrayList<>();
        List<UnmappedElement> unmapped = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.mapping() != null) {
                mappings.add(outcome.mapping());
            } else {
                unmapped.add(outcome.unmapped());
            }
        }
        report.mappings(mappings).unmappedElements(unmapped);

        MappingStatistics statistics = summarizer.statistics(elements.size(), mappable.size(), mappings, unmapped, components.size());
        report.statistics(statistics).recommendations(summarizer.recommendations(mappings, unmapped));

        log.info("Mapped {} of {} elements ({}%)", mappings.size(), mappable.size(),
                FormatUtil.compact(statistics.getSuccessRatePercent()));
        return report.build();
    }

    static void validateMinConfidence(double minConfidence) {
        if (Double.isNaN(minConfidence) || minConfidence < 0 || minConfidence > SimilarityScorer.MAX_SCORE) {
            throw new IllegalArgumentException("minConfidence must be between 0 and 100, got " + minConfidence);
        }
    }

    private Outcome resolve(FlatElement element, List<CatalogComponent> components, double minConfidence) {
        CatalogComponent best = null;
        double bestScore = 0.0;
        double[] scores = new double[components.size()];
        for (int i = 0; i < components.size(); i++) {
            scores[i] = scorer.score(element, components.get(i));
            if (best == null || scores[i] > bestScore) {
                best = components.get(i);
                bestScore = scores[i];
            }
        }

        if (best != null && bestScore >= minConfidence) {
            return new Outcome(element, createMapping(element, best, bestScore), null);
        }

        UnmappedElement.UnmappedElementBuilder unmapped = UnmappedElement.builder()
                .element(element)
                .bestScore(bestScore)
                .reason(bestScore > 0 ? UnmappedElement.BELOW_MINIMUM : UnmappedElement.NO_CANDIDATE)
                .suggestions(suggestions(element, components, scores));
        return new Outcome(element, null, unmapped.build());
    }

    Mapping createMapping(FlatElement element, CatalogComponent component, double confidence) {
        Map<String, Object> binding = bindingResolver.bind(element, component);
        return Mapping.builder()
                .element(element)
                .component(component)
                .confidence(confidence)
                .propsBinding(binding)
                .notes(bindingResolver.notes(element, component, binding))
                .exampleUsage(JsxFormatter.selfClosing(component.getName(), binding))
                .importPath(importPathResolver.resolve(component))
                .build();
    }

    private List<Suggestion> suggestions(FlatElement element, List<CatalogComponent> components, double[] scores) {
        List<Integer> ranked = new ArrayList<>();
        for (int i = 0; i < components.size(); i++) {
            ranked.add(i);
        }
        // List.sort is stable, so equal scores keep catalog order
        ranked.sort((a, b) -> Double.compare(scores[b], scores[a]));

        List<Suggestion> suggestions = new ArrayList<>();
        for (int i : ranked) {
            if (suggestions.size() >= suggestionLimit || scores[i] <= suggestionFloor) {
                break;
            }
            CatalogComponent component = components.get(i);
            suggestions.add(new Suggestion(
                    component.getName(),
                    scores[i],
                    suggestionReason(element, component, scores[i]),
                    JsxFormatter.selfClosing(component.getName(), Map.of())));
        }
        return suggestions;
    }

    static String suggestionReason(FlatElement element, CatalogComponent component, double score) {
        String componentName = component.getName().toLowerCase(Locale.ROOT);
        List<String> reasons = new ArrayList<>();

        if (SimilarityScorer.nameContains(element, component)) {
            reasons.add("name similarity");
        }
        NodeKind kind = element.getKind();
        if (kind == NodeKind.TEXT && (componentName.contains("input")
                || componentName.contains("textarea") || componentName.contains("textfield"))) {
            reasons.add("text element matches input component");
        } else if ((kind == NodeKind.RECTANGLE || kind == NodeKind.FRAME) && componentName.contains("button")) {
            reasons.add("rectangular element matches button component");
        } else if (kind == NodeKind.INSTANCE) {
            reasons.add("instance of a component");
        }

        if (reasons.isEmpty()) {
            reasons.add("partial match (score: " + FormatUtil.compact(score) + ")");
        }
        return String.join(", ", reasons);
    }

    private record Outcome(FlatElement element, Mapping mapping, UnmappedElement unmapped) {
    }
}

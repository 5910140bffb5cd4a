package com.layoutmapper.mapping;

import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.catalog.CatalogComponent;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic match score between a layout element and a catalog component, 0 to 100.
 *
 * Four independent bonuses are summed and capped:
 * name containment (30, or 20 for a shared name token), kind/category fit (40),
 * element is a component instance (10), component declares variants (5).
 */
public class SimilarityScorer {

    public static final double NAME_MATCH = 30.0;
    public static final double NAME_TOKEN_MATCH = 20.0;
    public static final double CATEGORY_MATCH = 40.0;
    public static final double INSTANCE_BONUS = 10.0;
    public static final double VARIANTS_BONUS = 5.0;
    public static final double MAX_SCORE = 100.0;

    public double score(FlatElement element, CatalogComponent component) {
        double score = nameScore(element, component);
        if (categoryMatches(element, component)) {
            score += CATEGORY_MATCH;
        }
        if (element.isComponentInstance()) {
            score += INSTANCE_BONUS;
        }
        if (component.hasVariants()) {
            score += VARIANTS_BONUS;
        }
        return Math.min(score, MAX_SCORE);
    }

    double nameScore(FlatElement element, CatalogComponent component) {
        if (nameContains(element, component)) {
            return NAME_MATCH;
        }
        String elementName = lower(element.getName());
        for (String token : lower(component.getName()).split("\\s+")) {
            if (!token.isEmpty() && elementName.contains(token)) {
                return NAME_TOKEN_MATCH;
            }
        }
        return 0.0;
    }

    /**
     * Either lower-cased name contains the other.
     */
    static boolean nameContains(FlatElement element, CatalogComponent component) {
        String elementName = lower(element.getName());
        String componentName = lower(component.getName());
        return elementName.contains(componentName) || componentName.contains(elementName);
    }

    static boolean categoryMatches(FlatElement element, CatalogComponent component) {
        Set<ComponentCategory> suited = ComponentCategory.forKind(element.getKind());
        return !suited.isEmpty() && !Collections.disjoint(suited, ComponentCategory.of(component));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}

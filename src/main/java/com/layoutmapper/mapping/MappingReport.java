package com.layoutmapper.mapping;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one mapping run. Every mappable element appears in exactly one of
 * {@link #getMappings()} and {@link #getUnmappedElements()}, both in element order.
 */
@Value
@Builder
public class MappingReport {

    @Singular("mapping")
    List<Mapping> mappings;

    @Singular("unmapped")
    List<UnmappedElement> unmappedElements;

    MappingStatistics statistics;

    @Singular("recommendation")
    List<Recommendation> recommendations;

    /**
     * Catalog entries that were skipped while indexing.
     */
    @Singular("error")
    List<String> errors;

    double minConfidence;

    /**
     * Mappings grouped by component name, groups in order of first appearance.
     */
    public Map<String, List<Mapping>> mappingsByComponent() {
        Map<String, List<Mapping>> groups = new LinkedHashMap<>();
        for (Mapping mapping : mappings) {
            groups.computeIfAbsent(mapping.getComponentName(), k -> new ArrayList<>()).add(mapping);
        }
        return groups;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

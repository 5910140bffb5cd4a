package com.layoutmapper.mapping;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Aggregate figures for one mapping run. Percentages use one decimal, averages two.
 */
@Value
@Builder
public class MappingStatistics {
    int totalElements;
    int mappableElements;
    int mappedCount;
    int unmappedCount;
    double successRatePercent;
    double averageConfidence;

    /**
     * Keys {@code high} (80 and up), {@code medium} (60 and up) and {@code low}.
     */
    Map<String, Integer> confidenceHistogram;

    /**
     * Mappings per component name, in first-use order.
     */
    Map<String, Integer> componentUsage;

    /**
     * Mapped elements per element type label.
     */
    Map<String, Integer> elementTypeDistribution;

    int uniqueComponentsUsed;
    int totalPropsBound;
    double averagePropsPerMapping;

    /**
     * Share of catalog components used at least once.
     */
    double catalogCoveragePercent;
}

package com.layoutmapper.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Tree-wide counts and ratios. Ratios are rounded to three decimals.
 */
@Value
@Builder
public class LayoutMetrics {
    int totalNodes;

    /**
     * Node count per depth, keyed {@code depth_N}.
     */
    Map<String, Integer> depthCounts;

    /**
     * Node count per raw type label.
     */
    Map<String, Integer> typeDistribution;

    /**
     * Nodes with at least one child.
     */
    int containerCount;

    int totalChildren;

    /**
     * Number of containers per child count, keyed {@code children_N}.
     */
    Map<String, Integer> fanOutHistogram;

    double averageChildren;

    double textDensity;

    double componentDensity;

    int maxDepth;
}

package com.layoutmapper.mapping;

import com.layoutmapper.util.FormatUtil;

import java.util.*;

/**
 * Computes report statistics and recommendations from the mapping outcome.
 */
class MappingSummarizer {

    static final double HIGH_CONFIDENCE = 80.0;
    static final double MEDIUM_CONFIDENCE = 60.0;

    MappingStatistics statistics(int totalElements, int mappableElements, List<Mapping> mappings,
                                 List<UnmappedElement> unmapped, int catalogSize) {
        Map<String, Integer> histogram = new LinkedHashMap<>();
        histogram.put("high", 0);
        histogram.put("medium", 0);
        histogram.put("low", 0);

        Map<String, Integer> usage = new LinkedHashMap<>();
        Map<String, Integer> types = new LinkedHashMap<>();
        double confidenceSum = 0;
        int propsBound = 0;

        for (Mapping mapping : mappings) {
            double confidence = mapping.getConfidence();
            confidenceSum += confidence;
            String bucket = confidence >= HIGH_CONFIDENCE ? "high" : confidence >= MEDIUM_CONFIDENCE ? "medium" : "low";
            histogram.merge(bucket, 1, Integer::sum);
            usage.merge(mapping.getComponentName(), 1, Integer::sum);
            types.merge(mapping.getElement().getTypeLabel(), 1, Integer::sum);
            propsBound += mapping.getPropsBinding().size();
        }

        int mapped = mappings.size();
        return MappingStatistics.builder()
                .totalElements(totalElements)
                .mappableElements(mappableElements)
                .mappedCount(mapped)
                .unmappedCount(unmapped.size())
                .successRatePercent(mappableElements == 0 ? 0.0 : FormatUtil.round(mapped * 100.0 / mappableElements, 1))
                .averageConfidence(mapped == 0 ? 0.0 : FormatUtil.round(confidenceSum / mapped, 2))
                .confidenceHistogram(Collections.unmodifiableMap(histogram))
                .componentUsage(Collections.unmodifiableMap(usage))
                .elementTypeDistribution(Collections.unmodifiableMap(types))
                .uniqueComponentsUsed(usage.size())
                .totalPropsBound(propsBound)
                .averagePropsPerMapping(FormatUtil.ratio(propsBound, mapped, 2))
                .catalogCoveragePercent(catalogSize == 0 ? 0.0 : FormatUtil.round(usage.size() * 100.0 / catalogSize, 1))
                .build();
    }

    List<Recommendation> recommendations(List<Mapping> mappings, List<UnmappedElement> unmapped) {
        List<Recommendation> recommendations = new ArrayList<>();

        Map<String, Integer> usage = new LinkedHashMap<>();
        mappings.forEach(m -> usage.merge(m.getComponentName(), 1, Integer::sum));
        String mostUsed = null;
        int mostUsedCount = 0;
        for (Map.Entry<String, Integer> entry : usage.entrySet()) {
            if (entry.getValue() > mostUsedCount) {
                mostUsed = entry.getKey();
                mostUsedCount = entry.getValue();
            }
        }
        if (mostUsed != null) {
            recommendations.add(new Recommendation(Recommendation.Type.MOST_USED_COMPONENT, mostUsed, mostUsedCount,
                    "'" + mostUsed + "' is the most frequently used component in this layout"));
        }

        if (!unmapped.isEmpty()) {
            recommendations.add(new Recommendation(Recommendation.Type.UNMAPPED_ELEMENTS, null, unmapped.size(),
                    unmapped.size() + " elements couldn't be mapped. Consider creating custom components "
                            + "or extending the design system."));
        }

        long missingRequired = mappings.stream().filter(Mapping::hasMissingRequiredProps).count();
        if (missingRequired > 0) {
            recommendations.add(new Recommendation(Recommendation.Type.MISSING_REQUIRED_PROPS, null, (int) missingRequired,
                    missingRequired + " components are missing required props. Please review the generated code."));
        }
        return recommendations;
    }
}

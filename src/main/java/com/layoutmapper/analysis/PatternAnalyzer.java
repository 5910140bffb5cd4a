package com.layoutmapper.analysis;

import com.layoutmapper.model.AutoLayout;
import com.layoutmapper.model.BoundingBox;
import com.layoutmapper.model.LayoutConstraints;
import com.layoutmapper.model.LayoutGrid;
import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.util.FormatUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * Detects spacing, alignment and responsive patterns among sibling nodes and
 * gathers tree-wide metrics, all in a single traversal.
 *
 * Only containers with at least two children that carry bounding boxes get
 * spacing and alignment patterns; responsive patterns only need children.
 */
public class PatternAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PatternAnalyzer.class);

    static final double SPACING_TOLERANCE = 1.0;
    static final double ALIGNMENT_TOLERANCE = 2.0;

    private static final List<AlignmentEdge> ALIGNMENT_PRECEDENCE = List.of(
            new AlignmentEdge("left", BoundingBox::getX),
            new AlignmentEdge("right", BoundingBox::getRight),
            new AlignmentEdge("top", BoundingBox::getY),
            new AlignmentEdge("bottom", BoundingBox::getBottom),
            new AlignmentEdge("center_x", BoundingBox::getCenterX),
            new AlignmentEdge("center_y", BoundingBox::getCenterY));

    public LayoutAnalysis analyzeLayout(LayoutNode root) {
        LayoutAnalysis.LayoutAnalysisBuilder analysis = LayoutAnalysis.builder();
        MetricsAccumulator metrics = new MetricsAccumulator();

        if (root != null) {
            root.walk((node, depth) -> {
                metrics.record(node, depth);
                for (LayoutGrid grid : node.getLayoutGrids()) {
                    analysis.grid(new GridUsage(node.getId(), node.getName(), grid));
                }
                if (node.hasChildren()) {
                    analyzeContainer(node, analysis);
                }
            });
        }

        LayoutAnalysis result = analysis.metrics(metrics.toMetrics()).build();
        log.debug("Layout analysis: {} spacing, {} alignment, {} responsive patterns over {} nodes",
                result.getSpacingPatterns().size(), result.getAlignmentPatterns().size(),
                result.getResponsivePatterns().size(), result.getMetrics().getTotalNodes());
        return result;
    }

    private void analyzeContainer(LayoutNode container, LayoutAnalysis.LayoutAnalysisBuilder analysis) {
        List<LayoutNode> children = container.getChildren();
        List<BoundingBox> boxes = children.stream()
                .map(LayoutNode::getBoundingBox)
                .filter(Objects::nonNull)
                .toList();

        if (boxes.size() >= 2) {
            analysis.spacingPattern(pattern(container, spacingPattern(boxes)));
            alignmentPattern(boxes).ifPresent(p -> analysis.alignmentPattern(pattern(container, p)));
        }
        for (String responsive : responsivePatterns(container)) {
            analysis.responsivePattern(pattern(container, responsive));
        }
    }

    private ContainerPattern pattern(LayoutNode container, String pattern) {
        return new ContainerPattern(container.getId(), container.getName(), pattern, container.getChildren().size());
    }

    /**
     * Equal edge-to-edge gaps along x, else along y, else {@code irregular_spacing}.
     * An axis only qualifies when its boxes follow one another, so a stacked column is
     * vertical even though its x gaps are all equal.
     */
    static String spacingPattern(List<BoundingBox> boxes) {
        List<BoundingBox> byX = new ArrayList<>(boxes);
        byX.sort(Comparator.comparingDouble(BoundingBox::getX).thenComparingDouble(BoundingBox::getY));
        OptionalDouble horizontal = equalGap(byX, BoundingBox::getX, BoundingBox::getRight);
        if (horizontal.isPresent()) {
            return "horizontal_equal_spacing_" + formatGap(horizontal.getAsDouble()) + "px";
        }

        List<BoundingBox> byY = new ArrayList<>(boxes);
        byY.sort(Comparator.comparingDouble(BoundingBox::getY).thenComparingDouble(BoundingBox::getX));
        OptionalDouble vertical = equalGap(byY, BoundingBox::getY, BoundingBox::getBottom);
        if (vertical.isPresent()) {
            return "vertical_equal_spacing_" + formatGap(vertical.getAsDouble()) + "px";
        }
        return "irregular_spacing";
    }

    private static OptionalDouble equalGap(List<BoundingBox> sorted,
                                           ToDoubleFunction<BoundingBox> start,
                                           ToDoubleFunction<BoundingBox> end) {
        double first = start.applyAsDouble(sorted.get(1)) - end.applyAsDouble(sorted.get(0));
        if (first <= -SPACING_TOLERANCE) {
            return OptionalDouble.empty();
        }
        for (int i = 2; i < sorted.size(); i++) {
            double gap = start.applyAsDouble(sorted.get(i)) - end.applyAsDouble(sorted.get(i - 1));
            if (Math.abs(gap - first) >= SPACING_TOLERANCE) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.of(first);
    }

    private static String formatGap(double gap) {
        return BigDecimal.valueOf(gap).setScale(0, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * First edge, in fixed precedence order, whose spread across all boxes is under the tolerance.
     */
    static Optional<String> alignmentPattern(List<BoundingBox> boxes) {
        for (AlignmentEdge edge : ALIGNMENT_PRECEDENCE) {
            DoubleSummaryStatistics stats = boxes.stream().mapToDouble(edge.coordinate()).summaryStatistics();
            if (stats.getMax() - stats.getMin() < ALIGNMENT_TOLERANCE) {
                return Optional.of(edge.name() + "_aligned");
            }
        }
        return Optional.empty();
    }

    static List<String> responsivePatterns(LayoutNode container) {
        List<String> patterns = new ArrayList<>();

        AutoLayout autoLayout = container.getAutoLayout();
        if (autoLayout != null && autoLayout.hasAxis() && autoLayout.hasAutoSizing()) {
            String pattern = autoLayout.getMode().toLowerCase(Locale.ROOT) + "_auto_layout";
            patterns.add(autoLayout.isWrap() ? pattern + "_wrap" : pattern);
        }

        List<LayoutNode> children = container.getChildren();
        long responsiveChildren = children.stream()
                .map(LayoutNode::getConstraints)
                .filter(Objects::nonNull)
                .filter(LayoutConstraints::isResponsive)
                .count();
        if (!children.isEmpty() && responsiveChildren * 2 > children.size()) {
            patterns.add("responsive_constraints");
        }
        return patterns;
    }

    private record AlignmentEdge(String name, ToDoubleFunction<BoundingBox> coordinate) {
    }

    private static final class MetricsAccumulator {
        private int totalNodes;
        private int textNodes;
        private int componentNodes;
        private int containers;
        private int totalChildren;
        private int maxDepth;
        private final Map<String, Integer> depthCounts = new LinkedHashMap<>();
        private final Map<String, Integer> typeDistribution = new LinkedHashMap<>();
        private final Map<String, Integer> fanOut = new TreeMap<>(Comparator.comparingInt(PatternAnalyzer::childCountOf));

        void record(LayoutNode node, int depth) {
            totalNodes++;
            maxDepth = Math.max(maxDepth, depth);
            depthCounts.merge("depth_" + depth, 1, Integer::sum);
            typeDistribution.merge(node.getTypeLabel(), 1, Integer::sum);

            if (node.getKind() == NodeKind.TEXT) {
                textNodes++;
            }
            if (node.getKind().isComponentLike()) {
                componentNodes++;
            }
            int childCount = node.getChildren().size();
            if (childCount > 0) {
                containers++;
                totalChildren += childCount;
                fanOut.merge("children_" + childCount, 1, Integer::sum);
            }
        }

        LayoutMetrics toMetrics() {
            return LayoutMetrics.builder()
                    .totalNodes(totalNodes)
                    .depthCounts(Collections.unmodifiableMap(depthCounts))
                    .typeDistribution(Collections.unmodifiableMap(typeDistribution))
                    .containerCount(containers)
                    .totalChildren(totalChildren)
                    .fanOutHistogram(Collections.unmodifiableMap(fanOut))
                    .averageChildren(FormatUtil.ratio(totalChildren, containers, 3))
                    .textDensity(FormatUtil.ratio(textNodes, totalNodes, 3))
                    .componentDensity(FormatUtil.ratio(componentNodes, totalNodes, 3))
                    .maxDepth(maxDepth)
                    .build();
        }
    }

    private static int childCountOf(String fanOutKey) {
        return Integer.parseInt(fanOutKey.substring("children_".length()));
    }
}

package com.layoutmapper.analysis;

import com.layoutmapper.model.Effect;
import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.LayoutNodeVisitor;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.model.Paint;
import com.layoutmapper.model.RgbaColor;
import com.layoutmapper.model.ShadowEffect;
import com.layoutmapper.model.SolidPaint;
import com.layoutmapper.model.TextStyle;
import com.layoutmapper.util.FormatUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Collects colors, text styles, drop shadows and size tokens from a node subtree in one
 * pre-order pass. Missing style data falls back to defaults; extraction never fails.
 */
public class StyleExtractor {
    private static final Logger log = LoggerFactory.getLogger(StyleExtractor.class);

    public StyleDigest extractStyles(LayoutNode root) {
        Collector collector = new Collector();
        if (root != null) {
            root.walk(collector);
        }
        StyleDigest digest = collector.toDigest();
        log.debug("Extracted {} colors, {} text styles, {} effects from {} layers",
                digest.getColors().size(), digest.getTextStyles().size(),
                digest.getEffects().size(), digest.getLayerCount());
        return digest;
    }

    private static String tone(RgbaColor color) {
        double brightness = color.brightness();
        if (brightness > 0.7) {
            return "light";
        }
        if (brightness < 0.3) {
            return "dark";
        }
        return "medium";
    }

    private static final class Collector implements LayoutNodeVisitor {
        private final Set<String> colors = new LinkedHashSet<>();
        private final Map<String, TextStyleFingerprint> textStyles = new LinkedHashMap<>();
        private final Set<String> effects = new LinkedHashSet<>();
        private final Set<String> sizes = new LinkedHashSet<>();
        private final Map<String, Set<String>> colorCategories = new LinkedHashMap<>();
        private int layerCount;

        @Override
        public void visit(LayoutNode node, int depth) {
            layerCount++;

            collectPaints(node.getFills(), "fill");
            collectPaints(node.getStrokes(), "stroke");

            if (node.getKind() == NodeKind.TEXT) {
                TextStyle style = node.getTextStyle() != null ? node.getTextStyle() : TextStyle.defaults();
                TextStyleFingerprint fingerprint = TextStyleFingerprint.of(style, node.getName());
                textStyles.putIfAbsent(fingerprint.key(), fingerprint);
            }

            for (Effect effect : node.getEffects()) {
                if (effect instanceof ShadowEffect shadow && shadow.isDropShadow()) {
                    effects.add(shadow.toCss());
                    categorize("shadow", shadow.getColor(), shadow.getColor().toRgba());
                }
            }

            if (node.getBoundingBox() != null) {
                sizes.add("width: " + FormatUtil.compact(node.getBoundingBox().getWidth()) + "px");
                sizes.add("height: " + FormatUtil.compact(node.getBoundingBox().getHeight()) + "px");
            }
        }

        private void collectPaints(List<Paint> paints, String usage) {
            for (Paint paint : paints) {
                if (paint instanceof SolidPaint solid) {
                    String css = solid.getColor().toCss();
                    colors.add(css);
                    categorize(usage, solid.getColor(), css);
                }
            }
        }

        private void categorize(String usage, RgbaColor color, String css) {
            colorCategories.computeIfAbsent(usage + "_" + tone(color), k -> new LinkedHashSet<>()).add(css);
        }

        StyleDigest toDigest() {
            Map<String, List<String>> colorGroups = new LinkedHashMap<>();
            colorCategories.forEach((category, values) -> colorGroups.put(category, List.copyOf(values)));

            Map<String, List<TextStyleFingerprint>> textGroups = new LinkedHashMap<>();
            for (TextStyleFingerprint style : textStyles.values()) {
                textGroups.computeIfAbsent(style.getCategory().label(), k -> new ArrayList<>()).add(style);
            }

            return StyleDigest.builder()
                    .colors(colors)
                    .textStyles(textStyles.values())
                    .effects(effects)
                    .sizes(sizes)
                    .layerCount(layerCount)
                    .colorCategories(Collections.unmodifiableMap(colorGroups))
                    .textStyleCategories(Collections.unmodifiableMap(textGroups))
                    .build();
        }
    }
}

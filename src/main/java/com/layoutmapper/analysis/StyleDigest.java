package com.layoutmapper.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Deduplicated style tokens of a layout subtree, each list in first-seen order.
 */
@Value
@Builder
public class StyleDigest {

    /**
     * Canonical fill and stroke colors, {@code rgb(...)} or {@code rgba(...)}.
     */
    @Singular("color")
    List<String> colors;

    @Singular("textStyle")
    List<TextStyleFingerprint> textStyles;

    /**
     * Drop shadows as CSS box-shadow values.
     */
    @Singular("effect")
    List<String> effects;

    /**
     * {@code width: Npx} and {@code height: Npx} tokens.
     */
    @Singular("size")
    List<String> sizes;

    int layerCount;

    /**
     * Colors grouped as {@code <usage>_<tone>}, e.g. {@code fill_light}, {@code shadow_dark}.
     */
    Map<String, List<String>> colorCategories;

    /**
     * Text styles grouped by size category label.
     */
    Map<String, List<TextStyleFingerprint>> textStyleCategories;

    /**
     * Renders the colors as CSS custom properties on {@code :root}.
     */
    public String toCssVariables() {
        StringBuilder css = new StringBuilder(":root {\n");
        for (int i = 0; i < colors.size(); i++) {
            css.append("  --color-").append(i + 1).append(": ").append(colors.get(i)).append(";\n");
        }
        css.append("}");
        return css.toString();
    }
}

package com.layoutmapper.model;

import com.layoutmapper.util.FormatUtil;
import lombok.Builder;
import lombok.Value;

/**
 * Typography of a text node. Missing values fall back to the design tool's defaults.
 */
@Value
@Builder(toBuilder = true)
public class TextStyle {

    @Builder.Default
    String fontFamily = "Unknown";

    @Builder.Default
    double fontWeight = 400;

    @Builder.Default
    double fontSize = 14;

    /**
     * Line height in px, or null when the node uses automatic line height.
     */
    Double lineHeightPx;

    /**
     * Line height as a percentage of font size, used when no px value is present.
     */
    Double lineHeightPercent;

    @Builder.Default
    double letterSpacing = 0;

    @Builder.Default
    String textAlignHorizontal = "LEFT";

    @Builder.Default
    String textCase = "ORIGINAL";

    @Builder.Default
    String textDecoration = "NONE";

    public static TextStyle defaults() {
        return TextStyle.builder().build();
    }

    /**
     * Display form of the line height: {@code "20px"}, {@code "120%"} or {@code "normal"}.
     */
    public String lineHeightLabel() {
        if (lineHeightPx != null) {
            return FormatUtil.compact(lineHeightPx) + "px";
        }
        if (lineHeightPercent != null) {
            return FormatUtil.compact(lineHeightPercent) + "%";
        }
        return "normal";
    }
}

package com.layoutmapper.analysis;

import com.layoutmapper.model.TextStyle;
import com.layoutmapper.util.FormatUtil;
import lombok.Value;

/**
 * Identity of a text style for deduplication: family, weight, size and line height.
 * The node it was first seen on is kept for reporting.
 */
@Value
public class TextStyleFingerprint {
    String fontFamily;
    double fontWeight;
    double fontSize;
    String lineHeight;
    String firstNodeName;
    TextStyleCategory category;

    static TextStyleFingerprint of(TextStyle style, String nodeName) {
        return new TextStyleFingerprint(
                style.getFontFamily(),
                style.getFontWeight(),
                style.getFontSize(),
                style.lineHeightLabel(),
                nodeName,
                TextStyleCategory.forFontSize(style.getFontSize()));
    }

    public String key() {
        return fontFamily + "|" + FormatUtil.compact(fontWeight) + "|" + FormatUtil.compact(fontSize) + "|" + lineHeight;
    }

    /**
     * e.g. {@code Inter 600 16px/24px}.
     */
    public String describe() {
        return fontFamily + " " + FormatUtil.compact(fontWeight) + " " + FormatUtil.compact(fontSize) + "px/" + lineHeight;
    }
}

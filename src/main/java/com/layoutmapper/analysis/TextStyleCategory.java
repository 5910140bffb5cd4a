package com.layoutmapper.analysis;

/**
 * Typographic role inferred from font size, largest first.
 */
public enum TextStyleCategory {
    HEADING(24),
    SUBHEADING(16),
    BODY_LARGE(14),
    BODY(12),
    CAPTION(0);

    private final double minFontSize;

    TextStyleCategory(double minFontSize) {
        this.minFontSize = minFontSize;
    }

    public static TextStyleCategory forFontSize(double fontSize) {
        for (TextStyleCategory category : values()) {
            if (fontSize >= category.minFontSize) {
                return category;
            }
        }
        return CAPTION;
    }

    public String label() {
        return name().toLowerCase();
    }
}

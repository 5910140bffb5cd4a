package com.layoutmapper.model;

import lombok.Value;

import java.util.Set;

/**
 * Resizing constraints a child declares relative to its parent frame.
 */
@Value
public class LayoutConstraints {

    private static final Set<String> RESPONSIVE_HORIZONTAL = Set.of("LEFT_RIGHT", "CENTER", "SCALE");
    private static final Set<String> RESPONSIVE_VERTICAL = Set.of("TOP_BOTTOM", "CENTER", "SCALE");

    String horizontal;
    String vertical;

    public boolean isHorizontallyResponsive() {
        return horizontal != null && RESPONSIVE_HORIZONTAL.contains(horizontal);
    }

    public boolean isVerticallyResponsive() {
        return vertical != null && RESPONSIVE_VERTICAL.contains(vertical);
    }

    /**
     * True when either axis stretches, scales or centers with the parent.
     */
    public boolean isResponsive() {
        return isHorizontallyResponsive() || isVerticallyResponsive();
    }
}

package com.layoutmapper.model;

import lombok.Builder;
import lombok.Value;

/**
 * Auto-layout settings of a frame. Absent on frames laid out manually.
 */
@Value
@Builder(toBuilder = true)
public class AutoLayout {

    /**
     * HORIZONTAL or VERTICAL.
     */
    String mode;

    @Builder.Default
    String primaryAxisSizingMode = "FIXED";

    @Builder.Default
    String counterAxisSizingMode = "FIXED";

    boolean wrap;

    double itemSpacing;

    String primaryAxisAlignItems;

    String counterAxisAlignItems;

    public boolean hasAxis() {
        return "HORIZONTAL".equals(mode) || "VERTICAL".equals(mode);
    }

    public boolean hasAutoSizing() {
        return "AUTO".equals(primaryAxisSizingMode) || "AUTO".equals(counterAxisSizingMode);
    }
}

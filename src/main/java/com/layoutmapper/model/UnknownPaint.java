package com.layoutmapper.model;

import lombok.Value;

/**
 * Paint whose type this engine does not interpret (video, pattern, future additions).
 */
@Value
public class UnknownPaint implements Paint {

    String rawType;

    boolean visible;

    @Override
    public PaintType getType() {
        return PaintType.UNKNOWN;
    }
}

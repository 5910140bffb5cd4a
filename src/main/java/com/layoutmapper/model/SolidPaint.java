package com.layoutmapper.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SolidPaint implements Paint {

    @NonNull
    RgbaColor color;

    @Builder.Default
    double opacity = 1.0;

    @Builder.Default
    boolean visible = true;

    public static SolidPaint of(RgbaColor color) {
        return SolidPaint.builder().color(color).build();
    }

    @Override
    public PaintType getType() {
        return PaintType.SOLID;
    }
}

package com.layoutmapper.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ImagePaint implements Paint {

    String imageRef;

    String scaleMode;

    @Builder.Default
    boolean visible = true;

    @Override
    public PaintType getType() {
        return PaintType.IMAGE;
    }
}

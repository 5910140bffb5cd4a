package com.layoutmapper.model;

import com.layoutmapper.util.FormatUtil;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Drop or inner shadow.
 */
@Value
@Builder(toBuilder = true)
public class ShadowEffect implements Effect {

    @NonNull
    EffectType type;

    @NonNull
    @Builder.Default
    RgbaColor color = RgbaColor.BLACK;

    double offsetX;
    double offsetY;
    double radius;
    double spread;

    @Builder.Default
    boolean visible = true;

    public boolean isDropShadow() {
        return type == EffectType.DROP_SHADOW;
    }

    /**
     * CSS box-shadow shorthand without spread: {@code "2px 4px 8px rgba(0, 0, 0, 0.25)"}.
     */
    public String toCss() {
        return FormatUtil.compact(offsetX) + "px "
                + FormatUtil.compact(offsetY) + "px "
                + FormatUtil.compact(radius) + "px "
                + color.toRgba();
    }
}

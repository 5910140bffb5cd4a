package com.layoutmapper.model;

import com.layoutmapper.util.FormatUtil;
import lombok.Value;

/**
 * Color with channels in the 0..1 range, as the design tool reports them.
 */
@Value
public class RgbaColor {
    double r;
    double g;
    double b;
    double a;

    public static final RgbaColor BLACK = new RgbaColor(0, 0, 0, 1);

    public static RgbaColor of(double r, double g, double b, double a) {
        return new RgbaColor(r, g, b, a);
    }

    public int red255() {
        return toByte(r);
    }

    public int green255() {
        return toByte(g);
    }

    public int blue255() {
        return toByte(b);
    }

    public boolean isOpaque() {
        return a == 1.0;
    }

    /**
     * Canonical CSS form: {@code rgb(r, g, b)} when fully opaque, otherwise {@code rgba(r, g, b, a)}.
     */
    public String toCss() {
        if (isOpaque()) {
            return "rgb(" + red255() + ", " + green255() + ", " + blue255() + ")";
        }
        return toRgba();
    }

    /**
     * Always the four-channel form, used where the alpha must be explicit (shadows).
     */
    public String toRgba() {
        return "rgba(" + red255() + ", " + green255() + ", " + blue255() + ", " + FormatUtil.compact(a) + ")";
    }

    /**
     * Mean of the three channels, 0..1.
     */
    public double brightness() {
        return (r + g + b) / 3;
    }

    private static int toByte(double channel) {
        return (int) Math.round(channel * 255);
    }
}

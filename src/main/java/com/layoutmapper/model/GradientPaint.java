package com.layoutmapper.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Linear, radial, angular or diamond gradient. Stops are kept in declaration order.
 */
@Value
@Builder(toBuilder = true)
public class GradientPaint implements Paint {

    @NonNull
    PaintType type;

    @Singular("stop")
    List<Stop> stops;

    @Builder.Default
    boolean visible = true;

    @Value
    public static class Stop {
        double position;
        RgbaColor color;
    }
}

package com.layoutmapper.model;

import lombok.Builder;
import lombok.Value;

/**
 * Absolute bounding box of a node, in canvas pixels.
 */
@Value
@Builder(toBuilder = true)
public class BoundingBox {
    double x;
    double y;
    double width;
    double height;

    public static BoundingBox of(double x, double y, double width, double height) {
        return new BoundingBox(x, y, width, height);
    }

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public double getCenterX() {
        return x + width / 2;
    }

    public double getCenterY() {
        return y + height / 2;
    }
}

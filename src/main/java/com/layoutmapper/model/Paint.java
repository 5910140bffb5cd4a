package com.layoutmapper.model;

/**
 * One entry of a node's fill or stroke list. Decoded once when the tree is built;
 * unrecognized paint types are kept as {@link UnknownPaint}.
 */
public interface Paint {

    PaintType getType();

    boolean isVisible();

    enum PaintType {
        SOLID,
        GRADIENT_LINEAR,
        GRADIENT_RADIAL,
        GRADIENT_ANGULAR,
        GRADIENT_DIAMOND,
        IMAGE,
        UNKNOWN;

        public static PaintType fromType(String type) {
            if (type == null) {
                return UNKNOWN;
            }
            return switch (type.trim().toUpperCase()) {
                case "SOLID" -> SOLID;
                case "GRADIENT_LINEAR" -> GRADIENT_LINEAR;
                case "GRADIENT_RADIAL" -> GRADIENT_RADIAL;
                case "GRADIENT_ANGULAR" -> GRADIENT_ANGULAR;
                case "GRADIENT_DIAMOND" -> GRADIENT_DIAMOND;
                case "IMAGE" -> IMAGE;
                default -> UNKNOWN;
            };
        }

        public boolean isGradient() {
            return name().startsWith("GRADIENT_");
        }
    }
}

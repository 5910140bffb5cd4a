package com.layoutmapper.model;

/**
 * One entry of a node's effect list (shadows, blurs). Decoded once when the tree is built.
 */
public interface Effect {

    EffectType getType();

    boolean isVisible();

    enum EffectType {
        DROP_SHADOW,
        INNER_SHADOW,
        LAYER_BLUR,
        BACKGROUND_BLUR,
        UNKNOWN;

        public static EffectType fromType(String type) {
            if (type == null) {
                return UNKNOWN;
            }
            return switch (type.trim().toUpperCase()) {
                case "DROP_SHADOW" -> DROP_SHADOW;
                case "INNER_SHADOW" -> INNER_SHADOW;
                case "LAYER_BLUR" -> LAYER_BLUR;
                case "BACKGROUND_BLUR" -> BACKGROUND_BLUR;
                default -> UNKNOWN;
            };
        }
    }
}

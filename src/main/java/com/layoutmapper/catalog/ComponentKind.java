package com.layoutmapper.catalog;

/**
 * Whether a catalog entry is a single component or a set of variant components.
 */
public enum ComponentKind {
    COMPONENT,
    COMPONENT_SET;

    public static ComponentKind fromType(String type) {
        if (type == null) {
            return COMPONENT;
        }
        String normalized = type.trim().toUpperCase().replace('-', '_');
        return switch (normalized) {
            case "COMPONENT_SET", "COMPONENTSET", "SET" -> COMPONENT_SET;
            default -> COMPONENT;
        };
    }
}

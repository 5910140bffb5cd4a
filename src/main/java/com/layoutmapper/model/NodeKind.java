package com.layoutmapper.model;

import java.util.Locale;

/**
 * Closed set of layout node types reported by the design tool.
 */
public enum NodeKind {
    DOCUMENT,
    CANVAS,
    FRAME,
    GROUP,
    SECTION,
    TEXT,
    RECTANGLE,
    ELLIPSE,
    VECTOR,

    /**
     * Placed copy of a reusable design-tool component.
     */
    INSTANCE,

    /**
     * Main definition of a reusable design-tool component.
     */
    COMPONENT,

    /**
     * Set of component variants.
     */
    COMPONENT_SET,

    OTHER;

    public static NodeKind fromType(String type) {
        if (type == null || type.isBlank()) {
            return OTHER;
        }
        String normalized = type.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "DOCUMENT" -> DOCUMENT;
            case "CANVAS", "PAGE" -> CANVAS;
            case "FRAME" -> FRAME;
            case "GROUP" -> GROUP;
            case "SECTION" -> SECTION;
            case "TEXT" -> TEXT;
            case "RECTANGLE" -> RECTANGLE;
            case "ELLIPSE" -> ELLIPSE;
            case "VECTOR" -> VECTOR;
            case "INSTANCE", "COMPONENT_INSTANCE" -> INSTANCE;
            case "COMPONENT", "COMPONENT_DEFINITION" -> COMPONENT;
            case "COMPONENT_SET" -> COMPONENT_SET;
            default -> OTHER;
        };
    }

    public boolean isComponentLike() {
        return this == INSTANCE || this == COMPONENT || this == COMPONENT_SET;
    }

    public boolean isContainer() {
        return this == FRAME || this == GROUP || this == SECTION;
    }

    public boolean isPrimitiveShape() {
        return this == RECTANGLE || this == ELLIPSE || this == VECTOR;
    }
}

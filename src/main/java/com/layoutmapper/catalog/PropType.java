package com.layoutmapper.catalog;

/**
 * Declared type of a component prop, with the TypeScript type it renders as.
 */
public enum PropType {
    BOOLEAN("boolean"),
    TEXT("string"),
    NUMBER("number"),
    VARIANT("string"),
    INSTANCE_SWAP("string"),
    UNKNOWN("any");

    private final String typeScriptType;

    PropType(String typeScriptType) {
        this.typeScriptType = typeScriptType;
    }

    public String getTypeScriptType() {
        return typeScriptType;
    }

    /**
     * Accepts both design-tool property types (VARIANT, TEXT, BOOLEAN, INSTANCE_SWAP)
     * and token-file types (string, boolean, number, enum).
     */
    public static PropType fromType(String type) {
        if (type == null || type.isBlank()) {
            return UNKNOWN;
        }
        return switch (type.trim().toUpperCase()) {
            case "BOOLEAN", "BOOL" -> BOOLEAN;
            case "TEXT", "STRING" -> TEXT;
            case "NUMBER", "INT", "INTEGER", "FLOAT" -> NUMBER;
            case "VARIANT", "ENUM" -> VARIANT;
            case "INSTANCE_SWAP" -> INSTANCE_SWAP;
            default -> UNKNOWN;
        };
    }
}

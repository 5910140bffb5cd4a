package com.layoutmapper.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.layoutmapper.model.RgbaColor;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient readers over Jackson trees. Missing or mistyped fields fall back to defaults.
 */
@UtilityClass
class JsonValues {

    static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return defaultValue;
        }
        return value.asText(defaultValue);
    }

    static String text(JsonNode node, String field) {
        return text(node, field, null);
    }

    static double number(JsonNode node, String field, double defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || !(value.isNumber() || value.isTextual())) {
            return defaultValue;
        }
        return value.asDouble(defaultValue);
    }

    static Double optionalNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.asDouble();
    }

    static boolean bool(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            return defaultValue;
        }
        return value.asBoolean();
    }

    static List<JsonNode> array(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<JsonNode> items = new ArrayList<>();
        if (value != null && value.isArray()) {
            value.forEach(items::add);
        }
        return items;
    }

    static RgbaColor color(JsonNode colorNode) {
        if (colorNode == null || !colorNode.isObject()) {
            return RgbaColor.BLACK;
        }
        return RgbaColor.of(
                number(colorNode, "r", 0),
                number(colorNode, "g", 0),
                number(colorNode, "b", 0),
                number(colorNode, "a", 1));
    }

    /**
     * Scalar JSON value as a Java object (String, Boolean, Long, Double), or its text form.
     */
    static Object scalar(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            return value.asText();
        }
        return value.toString();
    }
}

package com.layoutmapper.util;

import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Renders self-closing JSX elements for example usage.
 */
@UtilityClass
public class JsxFormatter {

    /**
     * {@code <Name label="Submit" disabled={false} count={3} />}, or {@code <Name />} without props.
     * The name goes through {@link NamingUtil#toComponentName}.
     * Props are rendered in map iteration order, keys through {@link NamingUtil#toPropName}.
     */
    public static String selfClosing(String componentName, Map<String, Object> props) {
        StringBuilder jsx = new StringBuilder("<").append(NamingUtil.toComponentName(componentName));
        if (props != null) {
            props.forEach((key, value) -> jsx.append(' ').append(attribute(key, value)));
        }
        return jsx.append(" />").toString();
    }

    static String attribute(String rawKey, Object value) {
        String key = NamingUtil.toPropName(rawKey);
        if (value instanceof Boolean flag) {
            return key + "={" + flag + "}";
        }
        if (value instanceof Double || value instanceof Float) {
            return key + "={" + FormatUtil.compact(((Number) value).doubleValue()) + "}";
        }
        if (value instanceof Number number) {
            return key + "={" + number + "}";
        }
        if (value == null) {
            return key + "={undefined}";
        }
        return key + "=\"" + value.toString().replace("\"", "&quot;") + "\"";
    }
}

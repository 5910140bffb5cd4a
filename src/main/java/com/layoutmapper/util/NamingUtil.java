package com.layoutmapper.util;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Naming conventions for generated component code.
 */
public class NamingUtil {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Turns a catalog name into a JSX component identifier.
     * Valid identifiers are kept as they are ("DatePicker"); others are split on
     * spaces, dashes, underscores and slashes and joined in PascalCase ("text field" -> "TextField").
     */
    public static String toComponentName(String name) {
        if (name == null || name.isBlank()) {
            return "Component";
        }
        String trimmed = name.trim();
        if (IDENTIFIER.matcher(trimmed).matches()) {
            return trimmed;
        }
        String pascal = toPascalCase(trimmed);
        if (pascal.isEmpty()) {
            return "Component";
        }
        return Character.isDigit(pascal.charAt(0)) ? "C" + pascal : pascal;
    }

    /**
     * Design-tool property keys carry an id suffix ("Label#12:3"); only the name part is kept.
     */
    public static String stripPropertyId(String key) {
        if (key == null) {
            return null;
        }
        int hash = key.indexOf('#');
        return hash > 0 ? key.substring(0, hash) : key;
    }

    /**
     * Turns a prop key into a JSX attribute / TypeScript member name.
     * The id suffix is dropped; valid identifiers are kept ("variant", "Label");
     * others become camelCase ("Has Icon" -> "hasIcon").
     */
    public static String toPropName(String key) {
        String name = stripPropertyId(key);
        if (name == null || name.isBlank()) {
            return "prop";
        }
        String trimmed = name.trim();
        if (IDENTIFIER.matcher(trimmed).matches()) {
            return trimmed;
        }
        String pascal = toPascalCase(trimmed);
        if (pascal.isEmpty()) {
            return "prop";
        }
        String camel = Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
        return Character.isDigit(camel.charAt(0)) ? "p" + camel : camel;
    }

    /**
     * Splits on separators and drops other non-identifier characters; word tails keep their case.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_\\s/.]+"))
                .map(word -> word.replaceAll("[^A-Za-z0-9]", ""))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase() + str.substring(1);
    }
}

package com.layoutmapper.codegen.util;

import com.layoutmapper.util.NamingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Manages named ES module imports for the generated scaffold, one statement per module path.
 */
public class ImportManager {

    private final Map<String, Set<String>> namesByPath = new TreeMap<>();

    /**
     * Adds a named import of a component from a module path such as {@code @acme/ui}.
     * The name goes through {@link NamingUtil#toComponentName} so it matches the JSX usage.
     * Blank paths are ignored.
     */
    public void addImport(String modulePath, String componentName) {
        if (modulePath == null || modulePath.isBlank()) {
            return;
        }
        namesByPath.computeIfAbsent(modulePath.trim(), p -> new TreeSet<>())
                .add(NamingUtil.toComponentName(componentName));
    }

    /**
     * Import statements sorted by module path, names sorted within each,
     * e.g. {@code import { Button, Input } from '@acme/ui';}.
     */
    public List<String> generateImports() {
        List<String> statements = new ArrayList<>();
        namesByPath.forEach((path, names) ->
                statements.add("import { " + String.join(", ", names) + " } from '" + path + "';"));
        return statements;
    }

    public boolean isEmpty() {
        return namesByPath.isEmpty();
    }
}

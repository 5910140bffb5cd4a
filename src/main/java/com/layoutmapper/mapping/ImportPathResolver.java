package com.layoutmapper.mapping;

import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.util.NamingUtil;

import java.util.Locale;

/**
 * Resolves the module a component is imported from.
 *
 * A declared import path always wins. Otherwise the first {@link ImportPathTable} entry
 * whose keyword occurs in the component name (or contains the whole name) gives
 * {@code <libraryRoot>/<Module>}; with no entry, {@code <libraryRoot>/<ComponentName>} using the JSX component name.
 */
public class ImportPathResolver {

    public static final String DEFAULT_LIBRARY_ROOT = "@skbkontur/react-ui";

    private final String libraryRoot;

    public ImportPathResolver() {
        this(DEFAULT_LIBRARY_ROOT);
    }

    public ImportPathResolver(String libraryRoot) {
        String root = libraryRoot == null || libraryRoot.isBlank() ? DEFAULT_LIBRARY_ROOT : libraryRoot.trim();
        this.libraryRoot = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
    }

    public String getLibraryRoot() {
        return libraryRoot;
    }

    public String resolve(CatalogComponent component) {
        if (component.getImportPath() != null && !component.getImportPath().isBlank()) {
            return component.getImportPath().trim();
        }
        String name = component.getName();
        String lower = name.toLowerCase(Locale.ROOT);
        for (ImportPathTable entry : ImportPathTable.values()) {
            if (lower.contains(entry.getKeyword()) || entry.getKeyword().contains(lower)) {
                return libraryRoot + "/" + entry.getModule();
            }
        }
        return libraryRoot + "/" + NamingUtil.toComponentName(name);
    }
}

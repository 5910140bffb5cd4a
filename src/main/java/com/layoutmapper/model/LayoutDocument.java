package com.layoutmapper.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A decoded design file: metadata plus the root of its node tree.
 */
@Data
@Builder
public class LayoutDocument {
    private String name;
    private String lastModified;
    private String version;
    private LayoutNode root;
    private List<String> warnings;

    public static LayoutDocumentBuilder builder() {
        return new LayoutDocumentBuilder()
                .warnings(new ArrayList<>());
    }

    public void addWarning(String warning) {
        if (warnings == null) warnings = new ArrayList<>();
        warnings.add(warning);
    }

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}

package com.layoutmapper.catalog;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw decoded catalog: components in source order plus the entries that could not be decoded.
 */
@Data
public class CatalogDocument {
    private String name;
    private final List<CatalogComponent> components = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void addComponent(CatalogComponent component) {
        components.add(component);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package com.layoutmapper.catalog;

import java.util.*;

/**
 * Indexed, read-only view of a component catalog.
 *
 * Iteration order of {@link #getComponents()} is the insertion order of the source list.
 * The mapper relies on it to break ties between equally scored components, so it is
 * part of this type's contract.
 */
public class Catalog {
    private final List<CatalogComponent> components = new ArrayList<>();
    private final Map<String, CatalogComponent> componentsByName = new HashMap<>();
    private final Map<Capability, List<CatalogComponent>> componentsByCapability = new EnumMap<>(Capability.class);
    private final Map<Integer, List<CatalogComponent>> componentsByPropCount = new TreeMap<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    Catalog() {
    }

    public static Catalog empty() {
        return new Catalog();
    }

    public List<CatalogComponent> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    void addComponent(CatalogComponent component) {
        components.add(component);
        componentsByName.putIfAbsent(key(component.getName()), component);
        for (Capability capability : Capability.of(component)) {
            componentsByCapability.computeIfAbsent(capability, c -> new ArrayList<>()).add(component);
        }
        componentsByPropCount.computeIfAbsent(component.getProps().size(), c -> new ArrayList<>()).add(component);
    }

    boolean containsName(String name) {
        return componentsByName.containsKey(key(name));
    }

    public Optional<CatalogComponent> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(componentsByName.get(key(name)));
    }

    public List<CatalogComponent> withCapability(Capability capability) {
        return Collections.unmodifiableList(componentsByCapability.getOrDefault(capability, List.of()));
    }

    public List<CatalogComponent> withPropCount(int propCount) {
        return Collections.unmodifiableList(componentsByPropCount.getOrDefault(propCount, List.of()));
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    void addError(String error) {
        errors.add(error);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}

package com.layoutmapper.catalog;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A reusable UI component from the design system catalog.
 * The name may be missing on raw input; the indexer rejects such entries.
 */
@Value
@Builder(toBuilder = true)
public class CatalogComponent {

    String id;

    String name;

    @NonNull
    @Builder.Default
    ComponentKind kind = ComponentKind.COMPONENT;

    String description;

    @Singular("prop")
    List<PropDef> props;

    @Singular("variant")
    List<VariantDef> variants;

    String importPath;

    @Singular("token")
    List<Token> tokens;

    public boolean hasVariants() {
        return !variants.isEmpty();
    }

    public Optional<PropDef> findProp(String propName) {
        return props.stream()
                .filter(p -> p.getName().equals(propName))
                .findFirst();
    }

    public Set<String> getPropNames() {
        Set<String> names = new LinkedHashSet<>();
        props.forEach(p -> names.add(p.getName()));
        return names;
    }

    public Set<String> getRequiredPropNames() {
        Set<String> names = new LinkedHashSet<>();
        props.stream()
                .filter(PropDef::isRequired)
                .forEach(p -> names.add(p.getName()));
        return names;
    }
}

package com.layoutmapper.mapping;

import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.catalog.CatalogComponent;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * An accepted pairing of a layout element with a catalog component.
 * Prop bindings keep the order in which they were derived.
 */
@Value
@Builder
public class Mapping {

    @NonNull
    FlatElement element;

    @NonNull
    CatalogComponent component;

    double confidence;

    @Singular("binding")
    Map<String, Object> propsBinding;

    @Singular("note")
    List<String> notes;

    /**
     * JSX usage example, e.g. {@code <Button variant="primary" />}.
     */
    String exampleUsage;

    String importPath;

    public String getComponentName() {
        return component.getName();
    }

    public boolean hasMissingRequiredProps() {
        return notes.stream().anyMatch(n -> n.startsWith(PropBindingResolver.MISSING_REQUIRED_PREFIX));
    }
}

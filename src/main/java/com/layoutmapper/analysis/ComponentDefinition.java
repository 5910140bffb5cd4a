package com.layoutmapper.analysis;

import com.layoutmapper.model.BoundingBox;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A main component found in the layout tree.
 */
@Value
@Builder
public class ComponentDefinition {
    String id;
    String name;
    String description;
    BoundingBox boundingBox;

    /**
     * Declared property names with the design tool's id suffix removed.
     */
    @Singular("propertyName")
    List<String> propertyNames;
}

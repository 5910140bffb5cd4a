package com.layoutmapper.analysis;

import com.layoutmapper.model.BoundingBox;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A placed instance linked to its main component by component id.
 */
@Value
@Builder
public class ComponentInstance {
    String id;
    String name;
    String componentId;

    /**
     * Name of the main component, or null when the component is not part of this tree.
     */
    String componentName;

    BoundingBox boundingBox;

    @Singular("propertyOverride")
    Map<String, Object> propertyOverrides;

    @Singular("override")
    List<InstanceOverride> overrides;

    public boolean isResolved() {
        return componentName != null;
    }

    public List<InstanceOverride> overridesOf(InstanceOverride.OverrideKind kind) {
        return overrides.stream().filter(o -> o.getKind() == kind).toList();
    }
}

package com.layoutmapper.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main components and instances found in one layout tree, both in pre-order.
 */
@Value
@Builder
public class ComponentInventory {

    @Singular("component")
    List<ComponentDefinition> components;

    @Singular("instance")
    List<ComponentInstance> instances;

    public static ComponentInventory empty() {
        return ComponentInventory.builder().build();
    }

    /**
     * Counts keyed "component" and "instance".
     */
    public Map<String, Integer> getTypeCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("component", components.size());
        counts.put("instance", instances.size());
        return counts;
    }

    public Optional<ComponentDefinition> findComponent(String id) {
        return components.stream().filter(c -> c.getId() != null && c.getId().equals(id)).findFirst();
    }

    public List<ComponentInstance> getUnresolvedInstances() {
        return instances.stream().filter(i -> !i.isResolved()).toList();
    }
}

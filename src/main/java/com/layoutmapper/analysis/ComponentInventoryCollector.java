package com.layoutmapper.analysis;

import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.util.NamingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the main components and instances of a layout tree.
 *
 * Instances without a component id are skipped. Each kept instance is linked to the
 * first main component in the tree with that id and carries the property values it sets
 * plus the text, fill and visibility overrides found in its subtree.
 */
public class ComponentInventoryCollector {
    private static final Logger log = LoggerFactory.getLogger(ComponentInventoryCollector.class);

    public ComponentInventory collect(LayoutNode root) {
        if (root == null) {
            return ComponentInventory.empty();
        }

        List<ComponentDefinition> components = new ArrayList<>();
        List<LayoutNode> instanceNodes = new ArrayList<>();
        root.walk((node, depth) -> {
            if (node.getKind() == NodeKind.COMPONENT) {
                components.add(toDefinition(node));
            } else if (node.getKind() == NodeKind.INSTANCE && node.getComponentId() != null) {
                instanceNodes.add(node);
            }
        });

        Map<String, String> namesById = new HashMap<>();
        for (ComponentDefinition component : components) {
            if (component.getId() != null) {
                namesById.putIfAbsent(component.getId(), component.getName());
            }
        }

        ComponentInventory.ComponentInventoryBuilder inventory = ComponentInventory.builder().components(components);
        for (LayoutNode node : instanceNodes) {
            inventory.instance(toInstance(node, namesById.get(node.getComponentId())));
        }

        ComponentInventory result = inventory.build();
        log.debug("Found {} components and {} instances ({} unresolved)", result.getComponents().size(),
                result.getInstances().size(), result.getUnresolvedInstances().size());
        return result;
    }

    private ComponentDefinition toDefinition(LayoutNode node) {
        ComponentDefinition.ComponentDefinitionBuilder definition = ComponentDefinition.builder()
                .id(node.getId())
                .name(node.getName())
                .description(node.getDescription())
                .boundingBox(node.getBoundingBox());
        node.getPropertyDefinitions().keySet().forEach(key -> definition.propertyName(NamingUtil.stripPropertyId(key)));
        return definition.build();
    }

    private ComponentInstance toInstance(LayoutNode node, String componentName) {
        return ComponentInstance.builder()
                .id(node.getId())
                .name(node.getName())
                .componentId(node.getComponentId())
                .componentName(componentName)
                .boundingBox(node.getBoundingBox())
                .propertyOverrides(node.getInstanceProperties())
                .overrides(collectOverrides(node))
                .build();
    }

    private List<InstanceOverride> collectOverrides(LayoutNode instance) {
        List<InstanceOverride> overrides = new ArrayList<>();
        List<String> names = new ArrayList<>();
        instance.walk((node, depth) -> {
            while (names.size() > depth) {
                names.remove(names.size() - 1);
            }
            names.add(node.getName());
            String path = String.join("/", names);

            node.getOverrides().forEach((field, value) -> {
                InstanceOverride.OverrideKind kind = InstanceOverride.OverrideKind.fromField(field);
                if (kind == InstanceOverride.OverrideKind.TEXT) {
                    String characters = node.getCharacters() == null ? "" : node.getCharacters();
                    overrides.add(new InstanceOverride(kind, path, field, characters, value));
                } else if (kind == InstanceOverride.OverrideKind.VISIBILITY) {
                    overrides.add(new InstanceOverride(kind, path, field, node.isVisible(), value));
                } else if (kind == InstanceOverride.OverrideKind.COLOR
                        && InstanceOverride.OverrideKind.fillIndex(field) < node.getFills().size()) {
                    overrides.add(new InstanceOverride(kind, path, field, null, value));
                }
            });
        });
        return overrides;
    }
}

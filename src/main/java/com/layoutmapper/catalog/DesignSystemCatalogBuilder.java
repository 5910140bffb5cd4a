package com.layoutmapper.catalog;

import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.model.Paint;
import com.layoutmapper.model.PropertyDefinition;
import com.layoutmapper.model.SolidPaint;
import com.layoutmapper.util.NamingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds catalog components from the main components of a design-system document.
 *
 * Every COMPONENT_SET becomes one entry whose COMPONENT children are its variants;
 * every COMPONENT outside a set becomes an entry of its own. Props come from the declared
 * property definitions. A set without definitions gets one VARIANT prop per key found in
 * its variant names ("Size=Large, State=Hover"). SOLID fills and strokes anywhere in the
 * subtree become color tokens, one per distinct usage and value.
 */
public class DesignSystemCatalogBuilder {
    private static final Logger log = LoggerFactory.getLogger(DesignSystemCatalogBuilder.class);

    public List<CatalogComponent> extractComponents(LayoutNode root) {
        List<CatalogComponent> components = new ArrayList<>();
        if (root == null) {
            return components;
        }

        Set<LayoutNode> variantNodes = Collections.newSetFromMap(new IdentityHashMap<>());
        root.walk((node, depth) -> {
            if (node.getKind() == NodeKind.COMPONENT_SET) {
                node.getChildren().stream()
                        .filter(child -> child.getKind() == NodeKind.COMPONENT)
                        .forEach(variantNodes::add);
                components.add(toCatalogComponent(node));
            } else if (node.getKind() == NodeKind.COMPONENT && !variantNodes.contains(node)) {
                components.add(toCatalogComponent(node));
            }
        });

        log.debug("Extracted {} components from design-system tree '{}'", components.size(), root.getName());
        return components;
    }

    public CatalogComponent toCatalogComponent(LayoutNode node) {
        boolean set = node.getKind() == NodeKind.COMPONENT_SET;
        CatalogComponent.CatalogComponentBuilder builder = CatalogComponent.builder()
                .id(node.getId())
                .name(node.getName())
                .kind(set ? ComponentKind.COMPONENT_SET : ComponentKind.COMPONENT)
                .description(node.getDescription());

        node.getPropertyDefinitions().forEach((key, definition) -> builder.prop(toPropDef(key, definition)));

        List<VariantDef> variants = set ? extractVariants(node) : List.of();
        builder.variants(variants);
        if (set && node.getPropertyDefinitions().isEmpty()) {
            variantProps(variants).forEach(builder::prop);
        }

        builder.tokens(extractColorTokens(node));
        return builder.build();
    }

    private PropDef toPropDef(String key, PropertyDefinition definition) {
        return PropDef.builder()
                .name(NamingUtil.stripPropertyId(key))
                .type(PropType.fromType(definition.getType()))
                .defaultValue(definition.getDefaultValue())
                .enumValues(definition.getVariantOptions())
                .build();
    }

    private List<VariantDef> extractVariants(LayoutNode set) {
        List<VariantDef> variants = new ArrayList<>();
        for (LayoutNode child : set.getChildren()) {
            if (child.getKind() != NodeKind.COMPONENT) {
                continue;
            }
            VariantDef.VariantDefBuilder variant = VariantDef.builder()
                    .name(child.getName())
                    .id(child.getId());
            parseVariantName(child.getName()).forEach(variant::property);
            // first color per usage
            Map<String, String> variantTokens = new LinkedHashMap<>();
            for (Token token : extractColorTokens(child)) {
                variantTokens.putIfAbsent(token.getUsage(), token.getValue());
            }
            variant.tokens(variantTokens);
            variants.add(variant.build());
        }
        return variants;
    }

    /**
     * "Size=Large, State=Hover" -> {Size: Large, State: Hover}; parts without '=' are ignored.
     */
    static Map<String, Object> parseVariantName(String name) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (String part : name.split(",")) {
            int eq = part.indexOf('=');
            if (eq > 0) {
                String key = part.substring(0, eq).trim();
                String value = part.substring(eq + 1).trim();
                if (!key.isEmpty()) {
                    properties.put(key, value);
                }
            }
        }
        return properties;
    }

    private List<PropDef> variantProps(List<VariantDef> variants) {
        Map<String, Set<String>> options = new LinkedHashMap<>();
        for (VariantDef variant : variants) {
            variant.getProperties().forEach((key, value) ->
                    options.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(String.valueOf(value)));
        }
        List<PropDef> props = new ArrayList<>();
        options.forEach((key, values) -> props.add(PropDef.builder()
                .name(key)
                .type(PropType.VARIANT)
                .defaultValue(values.iterator().next())
                .enumValues(values)
                .build()));
        return props;
    }

    /**
     * Color tokens from the SOLID fills and strokes of a subtree, named after the node they were found on.
     */
    List<Token> extractColorTokens(LayoutNode root) {
        Map<String, Token> tokens = new LinkedHashMap<>();
        root.walk((node, depth) -> {
            addColorTokens(tokens, node, node.getFills(), "fill");
            addColorTokens(tokens, node, node.getStrokes(), "stroke");
        });
        return new ArrayList<>(tokens.values());
    }

    private void addColorTokens(Map<String, Token> tokens, LayoutNode node, List<Paint> paints, String usage) {
        for (Paint paint : paints) {
            if (paint instanceof SolidPaint solid) {
                String value = solid.getColor().toRgba();
                tokens.putIfAbsent(usage + "|" + value, new Token("color", node.getName(), usage, value));
            }
        }
    }
}

package com.layoutmapper.catalog;

import java.util.EnumSet;
import java.util.Set;

/**
 * Capability tags derived from what a component declares.
 */
public enum Capability {
    HAS_VARIANTS,
    HAS_PROPS,
    HAS_REQUIRED_PROPS,
    HAS_TOKENS,
    HAS_IMPORT_PATH,
    COMPONENT_SET;

    public static Set<Capability> of(CatalogComponent component) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (!component.getVariants().isEmpty()) {
            capabilities.add(HAS_VARIANTS);
        }
        if (!component.getProps().isEmpty()) {
            capabilities.add(HAS_PROPS);
        }
        if (component.getProps().stream().anyMatch(PropDef::isRequired)) {
            capabilities.add(HAS_REQUIRED_PROPS);
        }
        if (!component.getTokens().isEmpty()) {
            capabilities.add(HAS_TOKENS);
        }
        if (component.getImportPath() != null && !component.getImportPath().isBlank()) {
            capabilities.add(HAS_IMPORT_PATH);
        }
        if (component.getKind() == ComponentKind.COMPONENT_SET) {
            capabilities.add(COMPONENT_SET);
        }
        return capabilities;
    }
}

package com.layoutmapper.mapping;

import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.model.NodeKind;

import java.util.*;

/**
 * Apparent category of a catalog component, and which element kinds each category suits.
 *
 * A component belongs to every category whose keyword occurs in its lower-cased name.
 * Every catalog entry is also a {@link #COMPONENT}, which is the category component
 * instances and definitions match.
 */
public enum ComponentCategory {
    INPUT("input"),
    TEXTAREA("textarea"),
    TEXTFIELD("textfield"),
    BUTTON("button"),
    CARD("card"),
    CONTAINER("container"),
    MODAL("modal"),
    DIALOG("dialog"),
    COMPONENT("component");

    private static final Map<NodeKind, Set<ComponentCategory>> CATEGORIES_BY_KIND = new EnumMap<>(NodeKind.class);

    static {
        CATEGORIES_BY_KIND.put(NodeKind.TEXT, EnumSet.of(INPUT, TEXTAREA, TEXTFIELD));
        CATEGORIES_BY_KIND.put(NodeKind.RECTANGLE, EnumSet.of(BUTTON, CARD, CONTAINER));
        CATEGORIES_BY_KIND.put(NodeKind.FRAME, EnumSet.of(MODAL, DIALOG, CARD));
        CATEGORIES_BY_KIND.put(NodeKind.INSTANCE, EnumSet.of(COMPONENT));
        CATEGORIES_BY_KIND.put(NodeKind.COMPONENT, EnumSet.of(COMPONENT));
    }

    private final String keyword;

    ComponentCategory(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Categories an element of this kind can fill; empty for kinds without a table entry.
     */
    public static Set<ComponentCategory> forKind(NodeKind kind) {
        return CATEGORIES_BY_KIND.getOrDefault(kind, Collections.emptySet());
    }

    public static Set<ComponentCategory> of(CatalogComponent component) {
        Set<ComponentCategory> categories = EnumSet.of(COMPONENT);
        String name = component.getName() == null ? "" : component.getName().toLowerCase(Locale.ROOT);
        for (ComponentCategory category : values()) {
            if (name.contains(category.keyword)) {
                categories.add(category);
            }
        }
        return categories;
    }
}

package com.layoutmapper.analysis;

import com.layoutmapper.model.BoundingBox;
import com.layoutmapper.model.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of one layout node with its position in the tree.
 */
@Value
@Builder
public class FlatElement {

    /**
     * Kinds that take part in component mapping.
     */
    public static final Set<NodeKind> MAPPABLE_KINDS = EnumSet.of(
            NodeKind.INSTANCE, NodeKind.TEXT, NodeKind.FRAME,
            NodeKind.RECTANGLE, NodeKind.ELLIPSE, NodeKind.VECTOR);

    /**
     * Pre-order position in the flattened list, starting at 0.
     */
    int index;

    String id;

    @NonNull
    String name;

    @NonNull
    NodeKind kind;

    /**
     * Raw type label as reported by the design tool.
     */
    String typeLabel;

    /**
     * Ancestor names and this node's name joined by "/".
     */
    @NonNull
    String path;

    int depth;

    BoundingBox boundingBox;

    boolean visible;

    String textContent;

    String componentId;

    @Singular("instanceProperty")
    Map<String, Object> instanceProperties;

    int childCount;

    public boolean isInstance() {
        return kind == NodeKind.INSTANCE;
    }

    public boolean isText() {
        return kind == NodeKind.TEXT;
    }

    public boolean isFrame() {
        return kind == NodeKind.FRAME;
    }

    public boolean isGroup() {
        return kind == NodeKind.GROUP;
    }

    public boolean isComponent() {
        return kind == NodeKind.COMPONENT;
    }

    public boolean isComponentSet() {
        return kind == NodeKind.COMPONENT_SET;
    }

    public boolean isMappable() {
        return MAPPABLE_KINDS.contains(kind);
    }

    public boolean hasTextContent() {
        return textContent != null && !textContent.isEmpty();
    }

    /**
     * An instance that points at a main component.
     */
    public boolean isComponentInstance() {
        return isInstance() && componentId != null && !componentId.isBlank();
    }
}

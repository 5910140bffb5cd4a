package com.layoutmapper.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * One element of a design document. Children are owned by value: a node never
 * references its parent and no subtree is shared, so the tree is acyclic by construction.
 */
@Value
@Builder(toBuilder = true)
public class LayoutNode {

    String id;

    @NonNull
    @Builder.Default
    String name = "Unnamed";

    @NonNull
    @Builder.Default
    NodeKind kind = NodeKind.OTHER;

    /**
     * The raw type string as reported by the design tool, kept for distributions.
     */
    String rawType;

    /**
     * Component description; present only on COMPONENT and COMPONENT_SET nodes.
     */
    String description;

    BoundingBox boundingBox;

    @Builder.Default
    boolean visible = true;

    @Builder.Default
    double opacity = 1.0;

    @Singular("fill")
    List<Paint> fills;

    @Singular("stroke")
    List<Paint> strokes;

    @Singular("effect")
    List<Effect> effects;

    /**
     * Present only on TEXT nodes.
     */
    TextStyle textStyle;

    /**
     * Text content; present only on TEXT nodes.
     */
    String characters;

    /**
     * Id of the main component; present only on INSTANCE nodes.
     */
    String componentId;

    /**
     * Instance property values keyed by property name; empty unless kind is INSTANCE.
     */
    @Singular("instanceProperty")
    Map<String, Object> instanceProperties;

    /**
     * Declared properties keyed by property key; empty unless kind is COMPONENT or COMPONENT_SET.
     */
    @Singular("propertyDefinition")
    Map<String, PropertyDefinition> propertyDefinitions;

    /**
     * Values this node overrides on its main component, keyed by field
     * ({@code characters}, {@code visible}, {@code fills[0]}).
     */
    @Singular("override")
    Map<String, Object> overrides;

    LayoutConstraints constraints;

    AutoLayout autoLayout;

    @Singular("layoutGrid")
    List<LayoutGrid> layoutGrids;

    @Singular("child")
    List<LayoutNode> children;

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public String getTypeLabel() {
        return rawType != null && !rawType.isBlank() ? rawType : kind.name();
    }

    /**
     * Visits this node and its descendants depth-first, pre-order, children in declared order.
     * Iterative so that very deep documents cannot overflow the stack.
     */
    public void walk(LayoutNodeVisitor visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(this, 0));
        while (!stack.isEmpty()) {
            Frame current = stack.pop();
            visitor.visit(current.node, current.depth);
            List<LayoutNode> kids = current.node.children;
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(new Frame(kids.get(i), current.depth + 1));
            }
        }
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int countNodes() {
        int[] count = {0};
        walk((node, depth) -> count[0]++);
        return count[0];
    }

    private record Frame(LayoutNode node, int depth) {
    }
}

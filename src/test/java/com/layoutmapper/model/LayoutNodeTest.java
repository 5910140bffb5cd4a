package com.layoutmapper.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LayoutNodeTest {

    @Test
    void testWalkIsPreOrderWithDepth() {
        LayoutNode root = LayoutNode.builder().name("root").kind(NodeKind.FRAME)
                .child(LayoutNode.builder().name("a").kind(NodeKind.FRAME)
                        .child(LayoutNode.builder().name("a1").kind(NodeKind.TEXT).build())
                        .build())
                .child(LayoutNode.builder().name("b").kind(NodeKind.RECTANGLE).build())
                .build();

        List<String> visited = new ArrayList<>();
        root.walk((node, depth) -> visited.add(node.getName() + "@" + depth));

        assertThat(visited).containsExactly("root@0", "a@1", "a1@2", "b@1");
        assertThat(root.countNodes()).isEqualTo(4);
    }

    @Test
    void testWalkHandlesDeepTrees() {
        LayoutNode node = LayoutNode.builder().name("leaf").kind(NodeKind.TEXT).build();
        for (int i = 0; i < 20_000; i++) {
            node = LayoutNode.builder().name("level" + i).kind(NodeKind.FRAME).child(node).build();
        }

        assertThat(node.countNodes()).isEqualTo(20_001);
    }

    @Test
    void testTypeLabelPrefersRawType() {
        LayoutNode node = LayoutNode.builder().kind(NodeKind.OTHER).rawType("BOOLEAN_OPERATION").build();

        assertThat(node.getTypeLabel()).isEqualTo("BOOLEAN_OPERATION");
        assertThat(LayoutNode.builder().kind(NodeKind.TEXT).build().getTypeLabel()).isEqualTo("TEXT");
    }
}

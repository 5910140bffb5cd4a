package com.layoutmapper.analysis;

import com.layoutmapper.Fixtures;
import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.parser.LayoutDocumentParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TreeFlattenerTest {

    private final TreeFlattener flattener = new TreeFlattener();

    @Test
    void testFlattenLoginForm() throws IOException {
        LayoutNode root = new LayoutDocumentParser().parse(Fixtures.path(Fixtures.LOGIN_FORM)).getRoot();

        List<FlatElement> elements = flattener.flatten(root);

        assertThat(elements).hasSize(root.countNodes());
        assertThat(elements).extracting(FlatElement::getIndex).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(elements.get(6).getPath()).isEqualTo("Document/Page 1/Login Form/Primary Button");
        assertThat(elements.get(6).getDepth()).isEqualTo(3);
        assertThat(elements.get(6).isComponentInstance()).isTrue();
        assertThat(elements.get(6).getInstanceProperties()).containsEntry("variant", "primary");
        assertThat(elements.get(2).getChildCount()).isEqualTo(5);
        assertThat(elements.get(3).getTextContent()).isEqualTo("Sign in");
        assertThat(elements.stream().filter(FlatElement::isMappable)).hasSize(6);
    }

    @Test
    void testPathsFollowSiblingsBackUp() {
        LayoutNode root = LayoutNode.builder().name("Root").kind(NodeKind.FRAME)
                .child(LayoutNode.builder().name("A").kind(NodeKind.FRAME)
                        .child(LayoutNode.builder().name("Deep").kind(NodeKind.TEXT).build())
                        .build())
                .child(LayoutNode.builder().name("B").kind(NodeKind.RECTANGLE).build())
                .build();

        assertThat(flattener.flatten(root)).extracting(FlatElement::getPath)
                .containsExactly("Root", "Root/A", "Root/A/Deep", "Root/B");
    }

    @Test
    void testFlattenIsRepeatable() throws IOException {
        LayoutNode root = new LayoutDocumentParser().parse(Fixtures.path(Fixtures.LOGIN_FORM)).getRoot();

        assertThat(flattener.flatten(root)).isEqualTo(flattener.flatten(root));
    }

    @Test
    void testGroupsAndCanvasesAreNotMappable() {
        LayoutNode root = LayoutNode.builder().name("Page").kind(NodeKind.CANVAS)
                .child(LayoutNode.builder().name("Group").kind(NodeKind.GROUP).build())
                .child(LayoutNode.builder().name("Icon").kind(NodeKind.VECTOR).build())
                .build();

        List<FlatElement> elements = flattener.flatten(root);

        assertThat(elements).extracting(FlatElement::isMappable).containsExactly(false, false, true);
        assertThat(elements.get(1).isGroup()).isTrue();
    }

    @Test
    void testKindFlags() {
        LayoutNode root = LayoutNode.builder().name("Library").kind(NodeKind.FRAME)
                .child(LayoutNode.builder().name("Buttons").kind(NodeKind.COMPONENT_SET)
                        .child(LayoutNode.builder().name("Button/Primary").kind(NodeKind.COMPONENT).build())
                        .build())
                .build();

        List<FlatElement> elements = flattener.flatten(root);

        assertThat(elements.get(0).isFrame()).isTrue();
        assertThat(elements.get(1).isComponentSet()).isTrue();
        assertThat(elements.get(2).isComponent()).isTrue();
        assertThat(elements.get(2).isMappable()).isFalse();
        assertThat(elements.get(2).getPath()).isEqualTo("Library/Buttons/Button/Primary");
    }

    @Test
    void testNullRoot() {
        assertThat(flattener.flatten(null)).isEmpty();
    }
}

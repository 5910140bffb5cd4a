package com.layoutmapper.parser;

import com.layoutmapper.Fixtures;
import com.layoutmapper.model.GradientPaint;
import com.layoutmapper.model.LayoutDocument;
import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.model.ShadowEffect;
import com.layoutmapper.model.SolidPaint;
import com.layoutmapper.model.UnknownPaint;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class LayoutDocumentParserTest {

    private final LayoutDocumentParser parser = new LayoutDocumentParser();

    @Test
    void testParseFileResponse() throws IOException {
        LayoutDocument doc = parser.parse(Fixtures.path(Fixtures.LOGIN_FORM));

        assertThat(doc.getName()).isEqualTo("Login Page");
        assertThat(doc.getVersion()).isEqualTo("4211");
        assertThat(doc.getRoot().getKind()).isEqualTo(NodeKind.DOCUMENT);
        assertThat(doc.getRoot().countNodes()).isEqualTo(8);
        assertThat(doc.hasWarnings()).isFalse();

        LayoutNode form = doc.getRoot().getChildren().get(0).getChildren().get(0);
        assertThat(form.getName()).isEqualTo("Login Form");
        assertThat(form.getAutoLayout().getMode()).isEqualTo("VERTICAL");
        assertThat(form.getAutoLayout().hasAutoSizing()).isTrue();
        assertThat(form.getEffects()).singleElement().isInstanceOf(ShadowEffect.class);

        LayoutNode button = form.getChildren().get(3);
        assertThat(button.getComponentId()).isEqualTo("10:2");
        assertThat(button.getInstanceProperties()).containsEntry("variant", "primary");

        LayoutNode title = form.getChildren().get(0);
        assertThat(title.getCharacters()).isEqualTo("Sign in");
        assertThat(title.getTextStyle().getFontSize()).isEqualTo(24.0);
        assertThat(title.getTextStyle().lineHeightLabel()).isEqualTo("32px");
    }

    @Test
    void testParseNodesResponse() {
        String json = """
                {"nodes": {"5:1": {"document": {"id": "5:1", "name": "Card", "type": "FRAME"}}}}
                """;

        LayoutDocument doc = parser.parse(json);

        assertThat(doc.getName()).isEqualTo("Unknown");
        assertThat(doc.getRoot().getId()).isEqualTo("5:1");
        assertThat(doc.getRoot().getKind()).isEqualTo(NodeKind.FRAME);
    }

    @Test
    void testParseBareNode() {
        LayoutDocument doc = parser.parse("""
                {"type": "RECTANGLE", "id": "2:2"}
                """);

        assertThat(doc.getRoot().getName()).isEqualTo("Unnamed");
        assertThat(doc.getRoot().getKind()).isEqualTo(NodeKind.RECTANGLE);
        assertThat(doc.getRoot().getChildren()).isEmpty();
    }

    @Test
    void testPaintVariants() {
        LayoutNode node = parser.parse("""
                {"type": "RECTANGLE", "fills": [
                  {"type": "SOLID", "color": {"r": 1, "g": 0, "b": 0, "a": 1}, "opacity": 0.5},
                  {"type": "GRADIENT_LINEAR", "gradientStops": [
                    {"position": 0, "color": {"r": 0, "g": 0, "b": 0, "a": 1}},
                    {"position": 1, "color": {"r": 1, "g": 1, "b": 1, "a": 1}}
                  ]},
                  {"type": "EMOJI"}
                ]}
                """).getRoot();

        assertThat(node.getFills()).hasSize(3);
        assertThat(node.getFills().get(0)).isInstanceOfSatisfying(SolidPaint.class,
                solid -> assertThat(solid.getColor().toCss()).isEqualTo("rgb(255, 0, 0)"));
        assertThat(node.getFills().get(1)).isInstanceOfSatisfying(GradientPaint.class,
                gradient -> assertThat(gradient.getStops()).hasSize(2));
        assertThat(node.getFills().get(2)).isInstanceOf(UnknownPaint.class);
    }

    @Test
    void testNonObjectChildrenBecomeWarnings() {
        LayoutDocument doc = parser.parse("""
                {"type": "FRAME", "name": "Root", "children": [42, {"type": "TEXT", "characters": "Hi"}]}
                """);

        assertThat(doc.getRoot().getChildren()).hasSize(1);
        assertThat(doc.hasWarnings()).isTrue();
        assertThat(doc.getWarnings()).containsExactly("Skipped non-object child of 'Root'");
    }

    @Test
    void testLayoutModeNoneHasNoAutoLayout() {
        LayoutNode node = parser.parse("""
                {"type": "FRAME", "layoutMode": "NONE"}
                """).getRoot();

        assertThat(node.getAutoLayout()).isNull();
    }

    @Test
    void testInvalidJsonIsRejected() {
        assertThatThrownBy(() -> parser.parse("{not json"))
                .isInstanceOf(LayoutParseException.class)
                .hasMessageStartingWith("Layout document is not valid JSON");
    }

    @Test
    void testObjectWithoutTreeIsRejected() {
        assertThatThrownBy(() -> parser.parse("{\"name\": \"Empty\"}"))
                .isInstanceOf(LayoutParseException.class)
                .hasMessageContaining("no node tree");
        assertThatThrownBy(() -> parser.parse("[1, 2]"))
                .isInstanceOf(LayoutParseException.class);
    }
}

package com.layoutmapper.parser;

import com.layoutmapper.Fixtures;
import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.CatalogDocument;
import com.layoutmapper.catalog.ComponentKind;
import com.layoutmapper.catalog.PropDef;
import com.layoutmapper.catalog.PropType;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class CatalogParserTest {

    private final CatalogParser parser = new CatalogParser();

    @Test
    void testParseCatalogFile() throws IOException {
        CatalogDocument doc = parser.parse(Fixtures.path(Fixtures.CATALOG));

        assertThat(doc.getName()).isEqualTo("Acme UI");
        assertThat(doc.getErrors()).isEmpty();
        assertThat(doc.getComponents()).extracting(CatalogComponent::getName)
                .containsExactly("Button", "Input", "Card");

        CatalogComponent button = doc.getComponents().get(0);
        assertThat(button.getKind()).isEqualTo(ComponentKind.COMPONENT_SET);
        assertThat(button.getVariants()).hasSize(2);
        assertThat(button.getRequiredPropNames()).containsExactly("label");

        PropDef variant = button.findProp("variant").orElseThrow();
        assertThat(variant.getType()).isEqualTo(PropType.VARIANT);
        assertThat(variant.getDefaultValue()).isEqualTo("primary");
        assertThat(variant.getEnumValues()).containsExactly("primary", "secondary", "danger");
        assertThat(button.findProp("disabled").orElseThrow().getDefaultValue()).isEqualTo(false);

        CatalogComponent input = doc.getComponents().get(1);
        assertThat(input.getPropNames()).containsExactly("value", "placeholder", "type");
        assertThat(input.findProp("type").orElseThrow().getDefaultValue()).isEqualTo("text");

        assertThat(doc.getComponents().get(2).getImportPath()).isEqualTo("@acme/ui/Card");
    }

    @Test
    void testParseDesignSystemFile() throws IOException {
        CatalogDocument doc = parser.parse(Fixtures.path(Fixtures.DESIGN_SYSTEM));

        assertThat(doc.getName()).isEqualTo("Acme Design System");
        assertThat(doc.getErrors()).isEmpty();
        assertThat(doc.getComponents()).extracting(CatalogComponent::getName)
                .containsExactly("Button", "Input", "Badge");
        assertThat(doc.getComponents().get(0).getVariants()).hasSize(2);
        assertThat(doc.getComponents().get(1).getPropNames()).containsExactly("Placeholder", "Disabled");
    }

    @Test
    void testParseBareArray() {
        CatalogDocument doc = parser.parse("""
                [{"name": "Badge"}, {"name": "Avatar", "variants": [{"name": "Size=Small"}]}]
                """);

        assertThat(doc.getComponents()).hasSize(2);
        assertThat(doc.getComponents().get(0).getKind()).isEqualTo(ComponentKind.COMPONENT);
        assertThat(doc.getComponents().get(1).getKind()).isEqualTo(ComponentKind.COMPONENT_SET);
    }

    @Test
    void testParseNameKeyedComponents() {
        CatalogDocument doc = parser.parse("""
                {"components": {
                  "Switch": {
                    "componentPropertyDefinitions": {
                      "Checked#4:1": {"type": "BOOLEAN", "defaultValue": true},
                      "Size#4:2": {"type": "VARIANT", "variantOptions": ["s", "m"]}
                    },
                    "tokens": {"color": {"track": "#ccc"}}
                  }
                }}
                """);

        CatalogComponent component = doc.getComponents().get(0);
        assertThat(component.getName()).isEqualTo("Switch");
        assertThat(component.getPropNames()).containsExactly("Checked", "Size");
        assertThat(component.findProp("Size").orElseThrow().getEnumValues()).containsExactly("s", "m");
        assertThat(component.getTokens()).singleElement()
                .satisfies(token -> {
                    assertThat(token.getFullName()).isEqualTo("color.track");
                    assertThat(token.getValue()).isEqualTo("#ccc");
                });
    }

    @Test
    void testBadEntriesAreRecordedAndSkipped() {
        CatalogDocument doc = parser.parse("""
                {"components": [{"name": "Button"}, "oops", {"name": "Card"}]}
                """);

        assertThat(doc.getComponents()).extracting(CatalogComponent::getName).containsExactly("Button", "Card");
        assertThat(doc.getErrors()).containsExactly("Catalog entry #2 is not an object");
        assertThat(doc.hasErrors()).isTrue();
    }

    @Test
    void testNullCatalogIsEmpty() {
        assertThat(parser.parse("null").getComponents()).isEmpty();
    }

    @Test
    void testUnrecognisedRootIsRejected() {
        assertThatThrownBy(() -> parser.parse("{\"items\": []}"))
                .isInstanceOf(LayoutParseException.class)
                .hasMessageContaining("'components'");
        assertThatThrownBy(() -> parser.parse("\"Button\""))
                .isInstanceOf(LayoutParseException.class);
    }
}

package com.layoutmapper.catalog;

import com.layoutmapper.Fixtures;
import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.model.RgbaColor;
import com.layoutmapper.model.SolidPaint;
import com.layoutmapper.parser.LayoutDocumentParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DesignSystemCatalogBuilderTest {

    private static final String BLUE = "rgba(51, 102, 255, 1)";
    private static final String WHITE = "rgba(255, 255, 255, 1)";

    private final DesignSystemCatalogBuilder builder = new DesignSystemCatalogBuilder();

    private List<CatalogComponent> components;

    @BeforeEach
    void setUp() throws IOException {
        LayoutNode root = new LayoutDocumentParser().parse(Fixtures.path(Fixtures.DESIGN_SYSTEM)).getRoot();
        components = builder.extractComponents(root);
    }

    @Test
    void testSetsAndStandaloneComponents() {
        assertThat(components).extracting(CatalogComponent::getName, CatalogComponent::getKind).containsExactly(
                tuple("Button", ComponentKind.COMPONENT_SET),
                tuple("Input", ComponentKind.COMPONENT),
                tuple("Badge", ComponentKind.COMPONENT_SET));
        assertThat(components.get(0).getId()).isEqualTo("10:0");
        assertThat(components.get(0).getDescription()).isEqualTo("Primary action");
    }

    @Test
    void testPropsFromPropertyDefinitions() {
        CatalogComponent button = components.get(0);
        assertThat(button.getPropNames()).containsExactly("Label", "Variant");

        PropDef variant = button.findProp("Variant").orElseThrow();
        assertThat(variant.getType()).isEqualTo(PropType.VARIANT);
        assertThat(variant.getDefaultValue()).isEqualTo("Primary");
        assertThat(variant.getEnumValues()).containsExactly("Primary", "Secondary");

        PropDef disabled = components.get(1).findProp("Disabled").orElseThrow();
        assertThat(disabled.getType()).isEqualTo(PropType.BOOLEAN);
        assertThat(disabled.getDefaultValue()).isEqualTo(false);
        assertThat(components.get(1).findProp("Placeholder").orElseThrow().getDefaultValue()).isEqualTo("Type here");
    }

    @Test
    void testVariantsFromComponentChildren() {
        CatalogComponent button = components.get(0);

        assertThat(button.getVariants()).extracting(VariantDef::getName, VariantDef::getId).containsExactly(
                tuple("Variant=Primary", "10:2"),
                tuple("Variant=Secondary", "10:3"));
        VariantDef primary = button.getVariants().get(0);
        assertThat(primary.getProperties()).containsExactly(entry("Variant", "Primary"));
        assertThat(primary.getTokens()).containsExactly(entry("fill", BLUE));
        assertThat(button.getVariants().get(1).getTokens()).containsExactly(entry("fill", WHITE), entry("stroke", BLUE));
    }

    @Test
    void testVariantPropsWithoutDefinitions() {
        CatalogComponent badge = components.get(2);

        assertThat(badge.getPropNames()).containsExactly("Tone", "Size");
        PropDef tone = badge.findProp("Tone").orElseThrow();
        assertThat(tone.getType()).isEqualTo(PropType.VARIANT);
        assertThat(tone.getEnumValues()).containsExactly("Info", "Danger");
        assertThat(tone.getDefaultValue()).isEqualTo("Info");
        assertThat(badge.getTokens()).isEmpty();
    }

    @Test
    void testColorTokensFromSubtree() {
        assertThat(components.get(0).getTokens())
                .extracting(Token::getName, Token::getUsage, Token::getValue)
                .containsExactly(
                        tuple("Variant=Primary", "fill", BLUE),
                        tuple("Label", "fill", WHITE),
                        tuple("Variant=Secondary", "stroke", BLUE));
        assertThat(components.get(1).getTokens()).extracting(Token::getFullName)
                .containsExactly("color.Input", "color.Input");
        assertThat(components.get(1).getTokens()).extracting(Token::getValue)
                .containsExactly(WHITE, "rgba(204, 204, 204, 1)");
    }

    @Test
    void testCatalogIndexesExtractedComponents() {
        Catalog catalog = new CatalogIndexer().buildIndex(components);

        assertThat(catalog.size()).isEqualTo(3);
        assertThat(catalog.getErrors()).isEmpty();
        assertThat(catalog.findByName("input")).isPresent();
        assertThat(catalog.withCapability(Capability.HAS_VARIANTS)).extracting(CatalogComponent::getName)
                .containsExactly("Button", "Badge");
    }

    @Test
    void testSingleComponentNode() {
        LayoutNode icon = LayoutNode.builder().id("7:1").name("Icon").kind(NodeKind.COMPONENT)
                .fill(SolidPaint.of(RgbaColor.of(0, 0, 0, 0.5)))
                .build();

        CatalogComponent component = builder.toCatalogComponent(icon);

        assertThat(component.getKind()).isEqualTo(ComponentKind.COMPONENT);
        assertThat(component.getProps()).isEmpty();
        assertThat(component.getVariants()).isEmpty();
        assertThat(component.getTokens()).containsExactly(new Token("color", "Icon", "fill", "rgba(0, 0, 0, 0.5)"));
    }

    @Test
    void testParseVariantName() {
        assertThat(DesignSystemCatalogBuilder.parseVariantName("Size=Large, State=Hover"))
                .containsExactly(entry("Size", "Large"), entry("State", "Hover"));
        assertThat(DesignSystemCatalogBuilder.parseVariantName("Default")).isEmpty();
    }
}

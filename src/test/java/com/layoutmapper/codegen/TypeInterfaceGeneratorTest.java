package com.layoutmapper.codegen;

import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.PropDef;
import com.layoutmapper.catalog.PropType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TypeInterfaceGeneratorTest {

    private final TypeInterfaceGenerator generator = new TypeInterfaceGenerator();

    @Test
    void testGenerateButtonProps() {
        CatalogComponent button = CatalogComponent.builder()
                .name("Button")
                .prop(PropDef.builder().name("label").type(PropType.TEXT).required(true).build())
                .prop(PropDef.builder().name("variant").type(PropType.VARIANT).defaultValue("primary").build())
                .prop(PropDef.builder().name("disabled").type(PropType.BOOLEAN).defaultValue(false).build())
                .prop(PropDef.builder().name("width").type(PropType.NUMBER).defaultValue(1.5).build())
                .build();

        String expected = """
                interface ButtonProps {
                  label: string;
                  variant?: string; // default: primary
                  disabled?: boolean; // default: false
                  width?: number; // default: 1.5
                  className?: string;
                  style?: React.CSSProperties;
                  children?: React.ReactNode;
                }""";

        assertThat(generator.generate(button)).isEqualTo(expected);
    }

    @Test
    void testMemberNamesAreIdentifiers() {
        CatalogComponent chip = CatalogComponent.builder()
                .name("Chip")
                .prop(PropDef.builder().name("Has Icon").type(PropType.BOOLEAN).build())
                .prop(PropDef.builder().name("2nd line").type(PropType.TEXT).build())
                .build();

        assertThat(generator.generate(chip))
                .contains("  hasIcon?: boolean;\n")
                .contains("  p2ndLine?: string;\n")
                .doesNotContain("Has Icon");
    }

    @Test
    void testDeclaredPassThroughPropIsNotRepeated() {
        CatalogComponent card = CatalogComponent.builder()
                .name("content card")
                .prop(PropDef.builder().name("children").type(PropType.INSTANCE_SWAP).required(true).build())
                .prop(PropDef.builder().name("elevation").build())
                .build();

        String generated = generator.generate(card);

        assertThat(generated).startsWith("interface ContentCardProps {");
        assertThat(generated).contains("  children: string;\n", "  elevation?: any;\n");
        assertThat(generated).doesNotContain("React.ReactNode");
    }
}

package com.layoutmapper.mapping;

import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.PropDef;
import com.layoutmapper.catalog.PropType;
import com.layoutmapper.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PropBindingResolverTest {

    private final PropBindingResolver resolver = new PropBindingResolver();

    @Test
    void testTextBindsToDeclaredLabelProp() {
        FlatElement submit = text("Submit", "Submit");
        CatalogComponent button = component("Button", "label", "variant");

        assertThat(resolver.bind(submit, button)).isEqualTo(Map.of("label", "Submit"));
    }

    @Test
    void testTextPropPriorityBeatsDeclarationOrder() {
        CatalogComponent component = component("Field", "title", "label", "value");

        assertThat(PropBindingResolver.textPropName(component)).isEqualTo("value");
    }

    @Test
    void testTextFallsBackToChildren() {
        assertThat(resolver.bind(text("Caption", "Hello"), component("Typography", "size")))
                .containsExactly(entry("children", "Hello"));
    }

    @Test
    void testInstancePropertiesComeFirst() {
        FlatElement element = FlatElement.builder()
                .name("Large Primary Button").kind(NodeKind.INSTANCE).path("Large Primary Button")
                .instanceProperty("variant", "secondary")
                .build();

        Map<String, Object> binding = resolver.bind(element, component("Button", "variant", "size"));

        assertThat(binding).containsExactly(entry("variant", "secondary"), entry("size", "large"));
    }

    @Test
    void testInputHeuristics() {
        FlatElement email = FlatElement.builder().name("Email Input").kind(NodeKind.FRAME).path("Email Input").build();
        FlatElement search = FlatElement.builder().name("search field").kind(NodeKind.FRAME).path("search field").build();

        assertThat(resolver.bind(email, component("Input"))).containsExactly(
                entry("type", "email"), entry("label", "Email"), entry("placeholder", "Enter your email"));
        assertThat(resolver.bind(search, component("Input"))).containsExactly(entry("placeholder", "Search..."));
    }

    @Test
    void testDangerButton() {
        FlatElement element = FlatElement.builder().name("delete-btn-sm").kind(NodeKind.RECTANGLE).path("x").build();

        assertThat(resolver.bind(element, component("Button")))
                .containsExactly(entry("variant", "danger"), entry("size", "small"));
    }

    @Test
    void testNotes() {
        FlatElement element = FlatElement.builder().name("Primary Button").kind(NodeKind.INSTANCE).path("p").build();
        CatalogComponent button = CatalogComponent.builder().name("Button")
                .prop(PropDef.builder().name("label").type(PropType.TEXT).required(true).build())
                .build();
        Map<String, Object> binding = resolver.bind(element, button);

        List<String> notes = resolver.notes(element, button, binding);

        assertThat(notes).containsExactly(
                PropBindingResolver.INSTANCE_NOTE,
                PropBindingResolver.UNSUPPORTED_PREFIX + "variant",
                PropBindingResolver.MISSING_REQUIRED_PREFIX + "label");
    }

    @Test
    void testNoNotesForCleanBinding() {
        FlatElement submit = text("Submit", "Submit");
        CatalogComponent button = component("Button", "label");

        assertThat(resolver.notes(submit, button, resolver.bind(submit, button))).isEmpty();
    }

    private static FlatElement text(String name, String content) {
        return FlatElement.builder().name(name).kind(NodeKind.TEXT).path(name).textContent(content).build();
    }

    private static CatalogComponent component(String name, String... props) {
        CatalogComponent.CatalogComponentBuilder builder = CatalogComponent.builder().name(name);
        for (String prop : props) {
            builder.prop(PropDef.builder().name(prop).type(PropType.TEXT).build());
        }
        return builder.build();
    }
}

package com.layoutmapper.mapping;

import com.layoutmapper.catalog.CatalogComponent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class ImportPathResolverTest {

    private final ImportPathResolver resolver = new ImportPathResolver();

    @ParameterizedTest
    @CsvSource({
            "Button, @skbkontur/react-ui/Button",
            "IconButton, @skbkontur/react-ui/Button",
            "Text Input, @skbkontur/react-ui/Input",
            "DatePicker, @skbkontur/react-ui/DatePicker",
            "Hero, @skbkontur/react-ui/Hero",
            "Text Field, @skbkontur/react-ui/TextField"
    })
    void testResolveByName(String name, String expected) {
        assertThat(resolver.resolve(CatalogComponent.builder().name(name).build())).isEqualTo(expected);
    }

    @Test
    void testDeclaredPathWins() {
        CatalogComponent card = CatalogComponent.builder().name("Button").importPath(" @acme/ui/Card ").build();

        assertThat(resolver.resolve(card)).isEqualTo("@acme/ui/Card");
    }

    @Test
    void testCustomLibraryRoot() {
        ImportPathResolver custom = new ImportPathResolver("@acme/ui/");

        assertThat(custom.getLibraryRoot()).isEqualTo("@acme/ui");
        assertThat(custom.resolve(CatalogComponent.builder().name("Modal").build())).isEqualTo("@acme/ui/Modal");
        assertThat(new ImportPathResolver("  ").getLibraryRoot()).isEqualTo(ImportPathResolver.DEFAULT_LIBRARY_ROOT);
    }
}

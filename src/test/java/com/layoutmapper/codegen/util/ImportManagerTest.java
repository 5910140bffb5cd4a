package com.layoutmapper.codegen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ImportManagerTest {

    @Test
    void testImportsAreDeduplicatedAndSorted() {
        ImportManager manager = new ImportManager();
        manager.addImport("@acme/ui/Input", "Input");
        manager.addImport("@acme/ui/Button", "Button");
        manager.addImport("@acme/ui/Input", "Input");
        manager.addImport("  ", "Card");
        manager.addImport(null, "Card");

        assertThat(manager.generateImports()).containsExactly(
                "import { Button } from '@acme/ui/Button';",
                "import { Input } from '@acme/ui/Input';");
    }

    @Test
    void testSharedModulePathGroupsNames() {
        ImportManager manager = new ImportManager();
        manager.addImport("@acme/ui", "Input");
        manager.addImport("@acme/ui", "Button");
        manager.addImport("@acme/forms", "text field");

        assertThat(manager.generateImports()).containsExactly(
                "import { TextField } from '@acme/forms';",
                "import { Button, Input } from '@acme/ui';");
    }

    @Test
    void testEmpty() {
        ImportManager manager = new ImportManager();

        assertThat(manager.isEmpty()).isTrue();
        assertThat(manager.generateImports()).isEmpty();

        manager.addImport("Card", "Card");
        assertThat(manager.isEmpty()).isFalse();
    }
}

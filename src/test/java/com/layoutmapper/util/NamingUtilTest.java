package com.layoutmapper.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "Button, Button",
            "IconButton, IconButton",
            "primary button, PrimaryButton",
            "date-picker/v2, DatePickerV2",
            "2 column layout, C2ColumnLayout"
    })
    void testToComponentName(String raw, String expected) {
        assertThat(NamingUtil.toComponentName(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "variant, variant",
            "Label#12:0, Label",
            "Has Icon, hasIcon",
            "show-label#3:1, showLabel",
            "2nd line, p2ndLine"
    })
    void testToPropName(String raw, String expected) {
        assertThat(NamingUtil.toPropName(raw)).isEqualTo(expected);
    }

    @Test
    void testBlankNameFallsBack() {
        assertThat(NamingUtil.toComponentName("  ")).isEqualTo("Component");
        assertThat(NamingUtil.toPropName("  ")).isEqualTo("prop");
        assertThat(NamingUtil.stripPropertyId("Label#12:0")).isEqualTo("Label");
    }
}

package com.layoutmapper.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RgbaColorTest {

    @Test
    void testOpaqueColorRendersAsRgb() {
        assertThat(RgbaColor.of(1, 0, 0, 1).toCss()).isEqualTo("rgb(255, 0, 0)");
    }

    @Test
    void testTranslucentColorRendersAsRgba() {
        assertThat(RgbaColor.of(1, 0, 0, 0.5).toCss()).isEqualTo("rgba(255, 0, 0, 0.5)");
    }

    @Test
    void testChannelsAreRounded() {
        RgbaColor color = RgbaColor.of(0.2, 0.4, 1, 1);

        assertThat(color.red255()).isEqualTo(51);
        assertThat(color.green255()).isEqualTo(102);
        assertThat(color.blue255()).isEqualTo(255);
    }

    @Test
    void testBrightnessIsChannelMean() {
        assertThat(RgbaColor.of(1, 1, 1, 1).brightness()).isEqualTo(1.0);
        assertThat(RgbaColor.BLACK.brightness()).isEqualTo(0.0);
        assertThat(RgbaColor.of(0.3, 0.6, 0.9, 1).brightness()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void testShadowFormAlwaysCarriesAlpha() {
        assertThat(RgbaColor.BLACK.toRgba()).isEqualTo("rgba(0, 0, 0, 1)");
    }
}

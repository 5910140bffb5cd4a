package com.layoutmapper.mapping;

import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.VariantDef;
import com.layoutmapper.model.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SimilarityScorerTest {

    private final SimilarityScorer scorer = new SimilarityScorer();

    @Test
    void testInstanceOfNamedComponentWithVariants() {
        FlatElement element = element("Primary Button", NodeKind.INSTANCE, "1:1");
        CatalogComponent button = CatalogComponent.builder().name("Button")
                .variant(VariantDef.builder().name("Primary").build())
                .build();

        assertThat(scorer.score(element, button)).isEqualTo(85.0);
    }

    @Test
    void testInstanceWithoutComponentIdGetsNoInstanceBonus() {
        FlatElement element = element("Primary Button", NodeKind.INSTANCE, null);

        assertThat(scorer.score(element, component("Button"))).isEqualTo(70.0);
    }

    @Test
    void testTextMatchesInputCategory() {
        assertThat(scorer.score(element("Email", NodeKind.TEXT, null), component("Input"))).isEqualTo(40.0);
        assertThat(scorer.score(element("Email", NodeKind.TEXT, null), component("Button"))).isZero();
    }

    @Test
    void testRectangleMatchesCardCategory() {
        assertThat(scorer.score(element("Background", NodeKind.RECTANGLE, null), component("Card"))).isEqualTo(40.0);
    }

    @Test
    void testSharedNameToken() {
        FlatElement element = element("Search field box", NodeKind.FRAME, null);

        assertThat(scorer.score(element, component("Text Field"))).isEqualTo(20.0);
    }

    @Test
    void testNameContainmentIsCaseInsensitiveBothWays() {
        assertThat(SimilarityScorer.nameContains(element("BUTTON", NodeKind.VECTOR, null), component("Icon Button"))).isTrue();
        assertThat(SimilarityScorer.nameContains(element("Icon Button", NodeKind.VECTOR, null), component("button"))).isTrue();
        assertThat(SimilarityScorer.nameContains(element("Avatar", NodeKind.VECTOR, null), component("Button"))).isFalse();
    }

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void testScoreStaysInRange(NodeKind kind) {
        List<CatalogComponent> catalog = List.of(
                component("Button"),
                component("Modal Dialog Card Container"),
                CatalogComponent.builder().name("Input Textarea Textfield")
                        .variant(VariantDef.builder().name("A").build()).build());

        for (CatalogComponent component : catalog) {
            double score = scorer.score(element("Button Input Modal", kind, "9:9"), component);
            assertThat(score).isBetween(0.0, SimilarityScorer.MAX_SCORE);
        }
    }

    private static CatalogComponent component(String name) {
        return CatalogComponent.builder().name(name).build();
    }

    static FlatElement element(String name, NodeKind kind, String componentId) {
        return FlatElement.builder()
                .index(0)
                .name(name)
                .kind(kind)
                .typeLabel(kind.name())
                .path(name)
                .visible(true)
                .componentId(componentId)
                .build();
    }
}

package com.layoutmapper.engine;

import com.layoutmapper.analysis.ComponentInventory;
import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.analysis.LayoutAnalysis;
import com.layoutmapper.analysis.StyleDigest;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structural and style digest of one layout tree.
 */
@Value
@Builder
public class LayoutDigest {
    List<FlatElement> elements;
    StyleDigest styles;
    LayoutAnalysis analysis;
    ComponentInventory inventory;

    public long getMappableCount() {
        return elements.stream().filter(FlatElement::isMappable).count();
    }
}

package com.layoutmapper.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A property declared on a main component or component set, as in
 * {@code "componentPropertyDefinitions": {"Label#12:0": {"type": "TEXT", "defaultValue": "OK"}}}.
 */
@Value
@Builder
public class PropertyDefinition {

    /**
     * Raw property type: VARIANT, TEXT, BOOLEAN or INSTANCE_SWAP.
     */
    String type;

    Object defaultValue;

    @Singular("variantOption")
    List<String> variantOptions;
}

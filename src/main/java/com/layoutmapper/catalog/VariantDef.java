package com.layoutmapper.catalog;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One variant of a component set, e.g. "State=Hover, Size=Large".
 */
@Value
@Builder
public class VariantDef {

    @NonNull
    String name;

    String id;

    @Singular("property")
    Map<String, Object> properties;

    /**
     * Token references keyed by usage, e.g. background -> colors.primary.
     */
    @Singular("token")
    Map<String, String> tokens;
}

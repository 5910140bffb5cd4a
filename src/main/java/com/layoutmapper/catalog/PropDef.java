package com.layoutmapper.catalog;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class PropDef {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    PropType type = PropType.UNKNOWN;

    boolean required;

    /**
     * Scalar default (String, Boolean, Long or Double), or null when none is declared.
     */
    Object defaultValue;

    @Singular("enumValue")
    List<String> enumValues;

    String description;

    public boolean hasDefault() {
        return defaultValue != null && !"".equals(defaultValue);
    }
}

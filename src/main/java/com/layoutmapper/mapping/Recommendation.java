package com.layoutmapper.mapping;

import lombok.Value;

@Value
public class Recommendation {

    public enum Type {
        MOST_USED_COMPONENT,
        UNMAPPED_ELEMENTS,
        MISSING_REQUIRED_PROPS
    }

    Type type;

    /**
     * Component the recommendation is about; only set for {@link Type#MOST_USED_COMPONENT}.
     */
    String componentName;

    int count;

    String message;

    public String getTypeLabel() {
        return type.name().toLowerCase();
    }
}

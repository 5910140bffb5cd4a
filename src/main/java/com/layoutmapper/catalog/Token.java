package com.layoutmapper.catalog;

import lombok.Value;

/**
 * A design token attached to a component: its group (color, spacing, ...), its name
 * within that group, where it is used, and its resolved value.
 */
@Value
public class Token {
    String type;
    String name;
    String usage;
    String value;

    public String getFullName() {
        return type + "." + name;
    }
}

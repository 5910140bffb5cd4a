package com.layoutmapper.analysis;

import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One value an instance (or a node inside it) overrides on its main component.
 */
@Value
public class InstanceOverride {

    OverrideKind kind;

    /**
     * Names from the instance down to the overriding node, joined by "/".
     */
    String path;

    /**
     * Overridden field: {@code characters}, {@code visible} or {@code fills[i]}.
     */
    String field;

    /**
     * Value the node carries itself; null for fill overrides.
     */
    Object original;

    Object value;

    public enum OverrideKind {
        TEXT,
        COLOR,
        VISIBILITY;

        private static final Pattern FILL_FIELD = Pattern.compile("fills\\[(\\d+)]");

        /**
         * Kind for an override field, or null when the field is not tracked.
         */
        public static OverrideKind fromField(String field) {
            if ("characters".equals(field)) {
                return TEXT;
            }
            if ("visible".equals(field)) {
                return VISIBILITY;
            }
            return FILL_FIELD.matcher(field).matches() ? COLOR : null;
        }

        static int fillIndex(String field) {
            Matcher matcher = FILL_FIELD.matcher(field);
            return matcher.matches() ? Integer.parseInt(matcher.group(1)) : -1;
        }
    }
}

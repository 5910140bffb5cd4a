package com.layoutmapper.codegen;

import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.PropDef;
import com.layoutmapper.util.FormatUtil;
import com.layoutmapper.util.NamingUtil;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Generates a TypeScript props interface for a catalog component.
 * Member names go through {@link NamingUtil#toPropName}.
 *
 * Example:
 * <pre>
 * interface ButtonProps {
 *   variant?: string; // default: primary
 *   disabled?: boolean;
 *   className?: string;
 *   style?: React.CSSProperties;
 *   children?: React.ReactNode;
 * }
 * </pre>
 */
public class TypeInterfaceGenerator {

    /**
     * Props every generated interface accepts, unless the component declares them itself.
     */
    static final Map<String, String> PASS_THROUGH_PROPS = new LinkedHashMap<>();

    static {
        PASS_THROUGH_PROPS.put("className", "string");
        PASS_THROUGH_PROPS.put("style", "React.CSSProperties");
        PASS_THROUGH_PROPS.put("children", "React.ReactNode");
    }

    public String generate(CatalogComponent component) {
        StringBuilder sb = new StringBuilder();
        sb.append("interface ").append(NamingUtil.toComponentName(component.getName())).append("Props {\n");

        for (PropDef prop : component.getProps()) {
            sb.append("  ").append(NamingUtil.toPropName(prop.getName()))
                    .append(prop.isRequired() ? "" : "?")
                    .append(": ").append(prop.getType().getTypeScriptType()).append(";");
            if (prop.hasDefault()) {
                sb.append(" // default: ").append(formatDefault(prop.getDefaultValue()));
            }
            sb.append("\n");
        }

        Set<String> declared = new HashSet<>();
        component.getPropNames().forEach(name -> declared.add(NamingUtil.toPropName(name)));
        PASS_THROUGH_PROPS.forEach((name, type) -> {
            if (!declared.contains(name)) {
                sb.append("  ").append(name).append("?: ").append(type).append(";\n");
            }
        });

        sb.append("}");
        return sb.toString();
    }

    private String formatDefault(Object value) {
        if (value instanceof Double number) {
            return FormatUtil.compact(number);
        }
        return String.valueOf(value);
    }
}

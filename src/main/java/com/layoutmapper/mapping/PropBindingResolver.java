package com.layoutmapper.mapping;

import com.layoutmapper.analysis.FlatElement;
import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.PropDef;

import java.util.*;

/**
 * Derives prop values for a mapped element and the notes that go with them.
 *
 * Sources, highest priority first; a lower source never overwrites a prop set by a higher one:
 * 1. instance property values of a component instance, copied verbatim
 * 2. text content, bound to the first declared text-like prop or to {@code children}
 * 3. heuristics on the element name for button-like and input-like elements
 */
public class PropBindingResolver {

    public static final String INSTANCE_NOTE = "Element is an instance of a design-tool component";
    public static final String UNSUPPORTED_PREFIX = "Note: Some mapped props may not be supported by component: ";
    public static final String MISSING_REQUIRED_PREFIX = "Warning: Missing required props: ";

    static final List<String> TEXT_PROP_PRIORITY = List.of("value", "text", "children", "label", "placeholder", "title");
    static final List<String> BUTTON_KEYWORDS = List.of("button", "btn", "submit", "confirm");
    static final List<String> INPUT_KEYWORDS = List.of("input", "field", "textfield");

    public Map<String, Object> bind(FlatElement element, CatalogComponent component) {
        Map<String, Object> binding = new LinkedHashMap<>();

        if (element.isInstance()) {
            binding.putAll(element.getInstanceProperties());
        }

        if (element.isText() && element.hasTextContent()) {
            binding.putIfAbsent(textPropName(component), element.getTextContent());
        }

        String name = element.getName().toLowerCase(Locale.ROOT);
        if (containsAny(name, BUTTON_KEYWORDS)) {
            buttonVariant(name).ifPresent(v -> binding.putIfAbsent("variant", v));
            buttonSize(name).ifPresent(s -> binding.putIfAbsent("size", s));
        }
        if (containsAny(name, INPUT_KEYWORDS)) {
            if (name.contains("email")) {
                binding.putIfAbsent("type", "email");
                binding.putIfAbsent("label", "Email");
                binding.putIfAbsent("placeholder", "Enter your email");
            } else if (name.contains("password")) {
                binding.putIfAbsent("type", "password");
                binding.putIfAbsent("label", "Password");
                binding.putIfAbsent("placeholder", "Enter your password");
            } else if (name.contains("search")) {
                binding.putIfAbsent("placeholder", "Search...");
            }
        }
        return binding;
    }

    /**
     * Notes for a binding: instance origin, props the component does not declare,
     * and required props left unbound.
     */
    public List<String> notes(FlatElement element, CatalogComponent component, Map<String, Object> binding) {
        List<String> notes = new ArrayList<>();
        if (element.isInstance()) {
            notes.add(INSTANCE_NOTE);
        }

        Set<String> declared = component.getPropNames();
        List<String> unsupported = binding.keySet().stream()
                .filter(p -> !declared.contains(p))
                .toList();
        if (!unsupported.isEmpty()) {
            notes.add(UNSUPPORTED_PREFIX + String.join(", ", unsupported));
        }

        List<String> missing = component.getRequiredPropNames().stream()
                .filter(p -> !binding.containsKey(p))
                .toList();
        if (!missing.isEmpty()) {
            notes.add(MISSING_REQUIRED_PREFIX + String.join(", ", missing));
        }
        return notes;
    }

    static String textPropName(CatalogComponent component) {
        for (String candidate : TEXT_PROP_PRIORITY) {
            for (PropDef prop : component.getProps()) {
                if (prop.getName().equalsIgnoreCase(candidate)) {
                    return prop.getName();
                }
            }
        }
        return "children";
    }

    private static Optional<String> buttonVariant(String name) {
        if (name.contains("primary")) {
            return Optional.of("primary");
        }
        if (name.contains("secondary")) {
            return Optional.of("secondary");
        }
        if (name.contains("danger") || name.contains("delete")) {
            return Optional.of("danger");
        }
        return Optional.empty();
    }

    private static Optional<String> buttonSize(String name) {
        if (name.contains("large") || name.contains("big")) {
            return Optional.of("large");
        }
        if (name.contains("small") || name.contains("sm")) {
            return Optional.of("small");
        }
        return Optional.empty();
    }

    private static boolean containsAny(String name, List<String> keywords) {
        return keywords.stream().anyMatch(name::contains);
    }
}

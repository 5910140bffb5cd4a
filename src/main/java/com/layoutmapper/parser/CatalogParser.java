package com.layoutmapper.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.layoutmapper.catalog.CatalogComponent;
import com.layoutmapper.catalog.CatalogDocument;
import com.layoutmapper.catalog.ComponentKind;
import com.layoutmapper.catalog.DesignSystemCatalogBuilder;
import com.layoutmapper.catalog.PropDef;
import com.layoutmapper.catalog.PropType;
import com.layoutmapper.catalog.Token;
import com.layoutmapper.catalog.VariantDef;
import com.layoutmapper.model.LayoutDocument;
import com.layoutmapper.util.NamingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Decodes a component catalog.
 *
 * Accepted shapes:
 * - A design-tool file or nodes response ({"document": ...} or {"nodes": ...}); its main
 *   components are turned into catalog entries by {@link DesignSystemCatalogBuilder}
 * - A JSON array of component objects
 * - {"components": [ ... ]}, optionally with "name" or "metadata.file_name"
 * - {"components": {"Button": { ... }}} as exported by token tools, keyed by component name
 *
 * Props are read from "props" (array or name-keyed object) or from design-tool
 * "componentPropertyDefinitions". Entries that are not objects, or that fail to decode,
 * are recorded as errors and skipped; the rest of the catalog is still returned.
 */
public class CatalogParser {
    private static final Logger log = LoggerFactory.getLogger(CatalogParser.class);

    private final ObjectMapper objectMapper;
    private final LayoutDocumentParser layoutParser;
    private final DesignSystemCatalogBuilder designSystemBuilder = new DesignSystemCatalogBuilder();

    public CatalogParser() {
        this(new ObjectMapper());
    }

    public CatalogParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.layoutParser = new LayoutDocumentParser(objectMapper);
    }

    public CatalogDocument parse(Path catalogFile) throws IOException {
        log.debug("Reading component catalog: {}", catalogFile);
        return parse(Files.readString(catalogFile));
    }

    public CatalogDocument parse(String json) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LayoutParseException("Catalog is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(tree);
    }

    public CatalogDocument parse(JsonNode tree) {
        CatalogDocument doc = new CatalogDocument();
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return doc;
        }

        if (tree.isObject() && (tree.has("document") || tree.has("nodes"))) {
            return parseDesignFile(tree);
        }

        JsonNode components;
        if (tree.isArray()) {
            components = tree;
        } else if (tree.isObject()) {
            doc.setName(JsonValues.text(tree, "name", JsonValues.text(tree.path("metadata"), "file_name")));
            components = tree.get("components");
            if (components == null) {
                throw new LayoutParseException("Catalog object has no 'components' field");
            }
        } else {
            throw new LayoutParseException("Catalog root must be an array or an object");
        }

        if (components.isArray()) {
            int index = 0;
            for (JsonNode entry : components) {
                index++;
                decodeEntry(doc, "#" + index, null, entry);
            }
        } else if (components.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = components.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                decodeEntry(doc, "'" + field.getKey() + "'", field.getKey(), field.getValue());
            }
        } else {
            throw new LayoutParseException("Catalog 'components' must be an array or an object");
        }

        log.debug("Decoded {} catalog components ({} errors)", doc.getComponents().size(), doc.getErrors().size());
        return doc;
    }

    private CatalogDocument parseDesignFile(JsonNode tree) {
        LayoutDocument layout = layoutParser.parse(tree);
        CatalogDocument doc = new CatalogDocument();
        doc.setName(layout.getName());
        designSystemBuilder.extractComponents(layout.getRoot()).forEach(doc::addComponent);
        if (layout.hasWarnings()) {
            log.warn("Design-system document '{}' decoded with {} warnings", layout.getName(), layout.getWarnings().size());
        }
        log.debug("Extracted {} catalog components from design-system document '{}'",
                doc.getComponents().size(), layout.getName());
        return doc;
    }

    private void decodeEntry(CatalogDocument doc, String ref, String keyedName, JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            doc.addError("Catalog entry " + ref + " is not an object");
            log.warn("Skipping catalog entry {}: not an object", ref);
            return;
        }
        try {
            doc.addComponent(parseComponent(entry, keyedName));
        } catch (Exception e) {
            doc.addError("Catalog entry " + ref + ": " + e.getMessage());
            log.warn("Failed to decode catalog entry {}: {}", ref, e.getMessage());
        }
    }

    /**
     * Decodes one component object. The name is left null when absent so the indexer can reject it.
     */
    public CatalogComponent parseComponent(JsonNode entry, String keyedName) {
        String name = JsonValues.text(entry, "name", keyedName);
        JsonNode variants = entry.get("variants");
        boolean hasVariantData = variants != null && variants.size() > 0;

        String kindText = JsonValues.text(entry, "type", JsonValues.text(entry, "kind"));
        ComponentKind kind = kindText != null
                ? ComponentKind.fromType(kindText)
                : hasVariantData ? ComponentKind.COMPONENT_SET : ComponentKind.COMPONENT;

        CatalogComponent.CatalogComponentBuilder builder = CatalogComponent.builder()
                .id(JsonValues.text(entry, "id", JsonValues.text(entry, "key")))
                .name(name)
                .kind(kind)
                .description(JsonValues.text(entry, "description"))
                .importPath(JsonValues.text(entry, "importPath", JsonValues.text(entry, "import_path")));

        decodeProps(entry.get("props"), builder);
        decodeProps(entry.get("componentPropertyDefinitions"), builder);
        decodeVariants(variants, builder);
        decodeTokens(entry.get("tokens"), builder);
        return builder.build();
    }

    private void decodeProps(JsonNode props, CatalogComponent.CatalogComponentBuilder builder) {
        if (props == null) {
            return;
        }
        if (props.isArray()) {
            for (JsonNode prop : props) {
                if (prop.isObject() && JsonValues.text(prop, "name") != null) {
                    builder.prop(parseProp(JsonValues.text(prop, "name"), prop));
                } else if (prop.isTextual()) {
                    builder.prop(PropDef.builder().name(prop.asText()).build());
                }
            }
        } else if (props.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.prop(parseProp(NamingUtil.stripPropertyId(field.getKey()), field.getValue()));
            }
        }
    }

    private PropDef parseProp(String name, JsonNode prop) {
        PropDef.PropDefBuilder builder = PropDef.builder()
                .name(name)
                .type(PropType.fromType(JsonValues.text(prop, "type")))
                .required(JsonValues.bool(prop, "required", false))
                .description(JsonValues.text(prop, "description"));

        for (String field : new String[]{"defaultValue", "default_value", "default"}) {
            JsonNode value = prop.get(field);
            if (value != null && !value.isNull()) {
                builder.defaultValue(JsonValues.scalar(value));
                break;
            }
        }
        for (String field : new String[]{"enumValues", "values", "variantOptions", "variant_options"}) {
            JsonNode values = prop.get(field);
            if (values != null && values.isArray()) {
                values.forEach(v -> builder.enumValue(v.asText()));
                break;
            }
        }
        return builder.build();
    }

    private void decodeVariants(JsonNode variants, CatalogComponent.CatalogComponentBuilder builder) {
        if (variants == null) {
            return;
        }
        if (variants.isArray()) {
            for (JsonNode variant : variants) {
                if (variant.isObject()) {
                    builder.variant(parseVariant(JsonValues.text(variant, "name", "Unnamed"), variant));
                } else if (variant.isTextual()) {
                    builder.variant(VariantDef.builder().name(variant.asText()).build());
                }
            }
        } else if (variants.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = variants.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.variant(parseVariant(field.getKey(), field.getValue()));
            }
        }
    }

    private VariantDef parseVariant(String name, JsonNode variant) {
        VariantDef.VariantDefBuilder builder = VariantDef.builder()
                .name(name)
                .id(JsonValues.text(variant, "id"));

        JsonNode properties = variant.has("properties") ? variant.get("properties") : variant.get("props");
        if (properties != null && properties.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                Object scalar = value.isObject() && value.has("value")
                        ? JsonValues.scalar(value.get("value"))
                        : JsonValues.scalar(value);
                if (scalar != null) {
                    builder.property(field.getKey(), scalar);
                }
            }
        }
        JsonNode tokens = variant.get("tokens");
        if (tokens != null && tokens.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = tokens.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.token(field.getKey(), field.getValue().asText());
            }
        }
        return builder.build();
    }

    private void decodeTokens(JsonNode tokens, CatalogComponent.CatalogComponentBuilder builder) {
        if (tokens == null) {
            return;
        }
        if (tokens.isArray()) {
            for (JsonNode token : tokens) {
                if (token.isObject()) {
                    builder.token(new Token(
                            JsonValues.text(token, "type"),
                            JsonValues.text(token, "name"),
                            JsonValues.text(token, "usage"),
                            tokenValue(token.get("value"))));
                }
            }
        } else if (tokens.isObject()) {
            // {"color": {"background": "#fff"}} grouped by token type
            Iterator<Map.Entry<String, JsonNode>> groups = tokens.fields();
            while (groups.hasNext()) {
                Map.Entry<String, JsonNode> group = groups.next();
                if (!group.getValue().isObject()) {
                    continue;
                }
                Iterator<Map.Entry<String, JsonNode>> entries = group.getValue().fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> entry = entries.next();
                    builder.token(new Token(group.getKey(), entry.getKey(), null, tokenValue(entry.getValue())));
                }
            }
        }
    }

    private String tokenValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}

package com.layoutmapper.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.layoutmapper.model.AutoLayout;
import com.layoutmapper.model.BlurEffect;
import com.layoutmapper.model.BoundingBox;
import com.layoutmapper.model.Effect;
import com.layoutmapper.model.GradientPaint;
import com.layoutmapper.model.ImagePaint;
import com.layoutmapper.model.LayoutConstraints;
import com.layoutmapper.model.LayoutDocument;
import com.layoutmapper.model.LayoutGrid;
import com.layoutmapper.model.LayoutNode;
import com.layoutmapper.model.NodeKind;
import com.layoutmapper.model.Paint;
import com.layoutmapper.model.PropertyDefinition;
import com.layoutmapper.model.ShadowEffect;
import com.layoutmapper.model.SolidPaint;
import com.layoutmapper.model.TextStyle;
import com.layoutmapper.model.UnknownEffect;
import com.layoutmapper.model.UnknownPaint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Decodes a design-tool file response (or a bare node) into an immutable {@link LayoutNode} tree.
 *
 * Accepted shapes:
 * - File response: {"name": ..., "lastModified": ..., "document": {node}}
 * - Nodes response: {"nodes": {"1:2": {"document": {node}}}} (first entry is used)
 * - A single node object with "type" and optional "children"
 *
 * Paints and effects are decoded into their tagged variants here, so later stages
 * never look at raw JSON.
 */
public class LayoutDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(LayoutDocumentParser.class);

    private final ObjectMapper objectMapper;

    public LayoutDocumentParser() {
        this(new ObjectMapper());
    }

    public LayoutDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LayoutDocument parse(Path layoutFile) throws IOException {
        log.debug("Reading layout document: {}", layoutFile);
        return parse(Files.readString(layoutFile));
    }

    public LayoutDocument parse(String json) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LayoutParseException("Layout document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(tree);
    }

    public LayoutDocument parse(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new LayoutParseException("Layout document root must be a JSON object");
        }

        LayoutDocument.LayoutDocumentBuilder builder = LayoutDocument.builder()
                .name(JsonValues.text(tree, "name", "Unknown"))
                .lastModified(JsonValues.text(tree, "lastModified"))
                .version(JsonValues.text(tree, "version"));

        JsonNode rootNode = locateRoot(tree);
        if (rootNode == null) {
            throw new LayoutParseException("Layout document has no node tree (expected 'document', 'nodes' or a node object)");
        }

        LayoutDocument document = builder.build();
        document.setRoot(parseNode(rootNode, document));
        log.debug("Decoded layout '{}' with {} nodes", document.getName(), document.getRoot().countNodes());
        return document;
    }

    /**
     * Decodes a single node object and its subtree.
     */
    public LayoutNode parseNode(JsonNode node) {
        return parseNode(node, LayoutDocument.builder().build());
    }

    private JsonNode locateRoot(JsonNode tree) {
        JsonNode document = tree.get("document");
        if (document != null && document.isObject()) {
            return document;
        }
        JsonNode nodes = tree.get("nodes");
        if (nodes != null && nodes.isObject()) {
            Iterator<JsonNode> entries = nodes.elements();
            while (entries.hasNext()) {
                JsonNode entry = entries.next();
                JsonNode entryDocument = entry.get("document");
                if (entryDocument != null && entryDocument.isObject()) {
                    return entryDocument;
                }
            }
            return null;
        }
        if (tree.has("type") || tree.has("children")) {
            return tree;
        }
        return null;
    }

    private LayoutNode parseNode(JsonNode node, LayoutDocument document) {
        String rawType = JsonValues.text(node, "type");
        NodeKind kind = NodeKind.fromType(rawType);
        String name = JsonValues.text(node, "name", "Unnamed");

        LayoutNode.LayoutNodeBuilder builder = LayoutNode.builder()
                .id(JsonValues.text(node, "id"))
                .name(name)
                .kind(kind)
                .rawType(rawType)
                .boundingBox(parseBoundingBox(node.get("absoluteBoundingBox")))
                .visible(JsonValues.bool(node, "visible", true))
                .opacity(JsonValues.number(node, "opacity", 1.0))
                .constraints(parseConstraints(node.get("constraints")))
                .autoLayout(parseAutoLayout(node));

        for (JsonNode fill : JsonValues.array(node, "fills")) {
            builder.fill(parsePaint(fill));
        }
        for (JsonNode stroke : JsonValues.array(node, "strokes")) {
            builder.stroke(parsePaint(stroke));
        }
        for (JsonNode effect : JsonValues.array(node, "effects")) {
            builder.effect(parseEffect(effect));
        }
        for (JsonNode grid : JsonValues.array(node, "layoutGrids")) {
            builder.layoutGrid(parseGrid(grid));
        }

        if (kind == NodeKind.TEXT) {
            builder.textStyle(parseTextStyle(node.get("style")))
                    .characters(JsonValues.text(node, "characters", ""));
        }

        if (kind == NodeKind.INSTANCE) {
            builder.componentId(JsonValues.text(node, "componentId"));
            JsonNode properties = node.get("componentProperties");
            if (properties != null && properties.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    Object value = instancePropertyValue(field.getValue());
                    if (value != null) {
                        builder.instanceProperty(field.getKey(), value);
                    }
                }
            }
        }

        if (kind == NodeKind.COMPONENT || kind == NodeKind.COMPONENT_SET) {
            builder.description(JsonValues.text(node, "description"));
            JsonNode definitions = node.get("componentPropertyDefinitions");
            if (definitions != null && definitions.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = definitions.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (field.getValue().isObject()) {
                        builder.propertyDefinition(field.getKey(), parsePropertyDefinition(field.getValue()));
                    }
                }
            }
        }

        JsonNode overrides = node.get("overrides");
        if (overrides != null && overrides.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Object value = JsonValues.scalar(field.getValue());
                if (value != null) {
                    builder.override(field.getKey(), value);
                }
            }
        }

        JsonNode children = node.get("children");
        if (children != null && !children.isArray()) {
            document.addWarning("Node '" + name + "' has a non-array 'children' field; ignored");
        }
        for (JsonNode child : JsonValues.array(node, "children")) {
            if (!child.isObject()) {
                document.addWarning("Skipped non-object child of '" + name + "'");
                log.warn("Skipped non-object child of node '{}'", name);
                continue;
            }
            builder.child(parseNode(child, document));
        }

        return builder.build();
    }

    private BoundingBox parseBoundingBox(JsonNode box) {
        if (box == null || !box.isObject()) {
            return null;
        }
        return BoundingBox.of(
                JsonValues.number(box, "x", 0),
                JsonValues.number(box, "y", 0),
                JsonValues.number(box, "width", 0),
                JsonValues.number(box, "height", 0));
    }

    private Paint parsePaint(JsonNode paint) {
        String rawType = JsonValues.text(paint, "type");
        Paint.PaintType type = Paint.PaintType.fromType(rawType);
        boolean visible = JsonValues.bool(paint, "visible", true);

        if (type == Paint.PaintType.SOLID) {
            JsonNode color = paint.get("color");
            if (color == null || !color.isObject()) {
                return new UnknownPaint(rawType, visible);
            }
            return SolidPaint.builder()
                    .color(JsonValues.color(color))
                    .opacity(JsonValues.number(paint, "opacity", 1.0))
                    .visible(visible)
                    .build();
        }
        if (type.isGradient()) {
            GradientPaint.GradientPaintBuilder gradient = GradientPaint.builder().type(type).visible(visible);
            for (JsonNode stop : JsonValues.array(paint, "gradientStops")) {
                gradient.stop(new GradientPaint.Stop(
                        JsonValues.number(stop, "position", 0),
                        JsonValues.color(stop.get("color"))));
            }
            return gradient.build();
        }
        if (type == Paint.PaintType.IMAGE) {
            return ImagePaint.builder()
                    .imageRef(JsonValues.text(paint, "imageRef"))
                    .scaleMode(JsonValues.text(paint, "scaleMode"))
                    .visible(visible)
                    .build();
        }
        return new UnknownPaint(rawType, visible);
    }

    private Effect parseEffect(JsonNode effect) {
        String rawType = JsonValues.text(effect, "type");
        Effect.EffectType type = Effect.EffectType.fromType(rawType);
        boolean visible = JsonValues.bool(effect, "visible", true);

        switch (type) {
            case DROP_SHADOW, INNER_SHADOW -> {
                JsonNode offset = effect.path("offset");
                return ShadowEffect.builder()
                        .type(type)
                        .color(JsonValues.color(effect.get("color")))
                        .offsetX(offset.isObject() ? JsonValues.number(offset, "x", 0) : 0)
                        .offsetY(offset.isObject() ? JsonValues.number(offset, "y", 0) : 0)
                        .radius(JsonValues.number(effect, "radius", 0))
                        .spread(JsonValues.number(effect, "spread", 0))
                        .visible(visible)
                        .build();
            }
            case LAYER_BLUR, BACKGROUND_BLUR -> {
                return new BlurEffect(type, JsonValues.number(effect, "radius", 0), visible);
            }
            default -> {
                return new UnknownEffect(rawType, visible);
            }
        }
    }

    private TextStyle parseTextStyle(JsonNode style) {
        if (style == null || !style.isObject()) {
            return TextStyle.defaults();
        }
        Double percent = JsonValues.optionalNumber(style, "lineHeightPercentFontSize");
        if (percent == null) {
            percent = JsonValues.optionalNumber(style, "lineHeightPercent");
        }
        return TextStyle.builder()
                .fontFamily(JsonValues.text(style, "fontFamily", "Unknown"))
                .fontWeight(JsonValues.number(style, "fontWeight", 400))
                .fontSize(JsonValues.number(style, "fontSize", 14))
                .lineHeightPx(JsonValues.optionalNumber(style, "lineHeightPx"))
                .lineHeightPercent(percent)
                .letterSpacing(JsonValues.number(style, "letterSpacing", 0))
                .textAlignHorizontal(JsonValues.text(style, "textAlignHorizontal", "LEFT"))
                .textCase(JsonValues.text(style, "textCase", "ORIGINAL"))
                .textDecoration(JsonValues.text(style, "textDecoration", "NONE"))
                .build();
    }

    private LayoutConstraints parseConstraints(JsonNode constraints) {
        if (constraints == null || !constraints.isObject()) {
            return null;
        }
        return new LayoutConstraints(
                JsonValues.text(constraints, "horizontal"),
                JsonValues.text(constraints, "vertical"));
    }

    private AutoLayout parseAutoLayout(JsonNode node) {
        String mode = JsonValues.text(node, "layoutMode");
        if (mode == null || "NONE".equals(mode)) {
            return null;
        }
        return AutoLayout.builder()
                .mode(mode)
                .primaryAxisSizingMode(JsonValues.text(node, "primaryAxisSizingMode", "FIXED"))
                .counterAxisSizingMode(JsonValues.text(node, "counterAxisSizingMode", "FIXED"))
                .wrap("WRAP".equals(JsonValues.text(node, "layoutWrap")))
                .itemSpacing(JsonValues.number(node, "itemSpacing", 0))
                .primaryAxisAlignItems(JsonValues.text(node, "primaryAxisAlignItems"))
                .counterAxisAlignItems(JsonValues.text(node, "counterAxisAlignItems"))
                .build();
    }

    private LayoutGrid parseGrid(JsonNode grid) {
        return LayoutGrid.builder()
                .pattern(JsonValues.text(grid, "pattern"))
                .sectionSize(JsonValues.number(grid, "sectionSize", 0))
                .gutterSize(JsonValues.number(grid, "gutterSize", 0))
                .alignment(JsonValues.text(grid, "alignment"))
                .count((int) JsonValues.number(grid, "count", 0))
                .offset(JsonValues.number(grid, "offset", 0))
                .build();
    }

    private PropertyDefinition parsePropertyDefinition(JsonNode definition) {
        PropertyDefinition.PropertyDefinitionBuilder builder = PropertyDefinition.builder()
                .type(JsonValues.text(definition, "type"))
                .defaultValue(JsonValues.scalar(definition.get("defaultValue")));
        for (JsonNode option : JsonValues.array(definition, "variantOptions")) {
            builder.variantOption(option.asText());
        }
        return builder.build();
    }

    /**
     * Instance properties arrive as {"type": "VARIANT", "value": "primary"}; the bare value is kept.
     */
    private Object instancePropertyValue(JsonNode property) {
        if (property != null && property.isObject() && property.has("value")) {
            return JsonValues.scalar(property.get("value"));
        }
        return JsonValues.scalar(property);
    }
}

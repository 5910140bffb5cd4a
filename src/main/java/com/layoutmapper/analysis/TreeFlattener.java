package com.layoutmapper.analysis;

import com.layoutmapper.model.LayoutNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a node tree into a pre-order list, one element per node.
 */
public class TreeFlattener {
    private static final Logger log = LoggerFactory.getLogger(TreeFlattener.class);

    public List<FlatElement> flatten(LayoutNode root) {
        List<FlatElement> elements = new ArrayList<>();
        if (root == null) {
            return elements;
        }

        // paths.get(d) is the path of the most recent node seen at depth d
        List<String> paths = new ArrayList<>();
        root.walk((node, depth) -> {
            while (paths.size() > depth) {
                paths.remove(paths.size() - 1);
            }
            String path = depth == 0 ? node.getName() : paths.get(depth - 1) + "/" + node.getName();
            paths.add(path);
            elements.add(toElement(node, elements.size(), path, depth));
        });

        log.debug("Flattened {} nodes ({} mappable)", elements.size(),
                elements.stream().filter(FlatElement::isMappable).count());
        return elements;
    }

    private FlatElement toElement(LayoutNode node, int index, String path, int depth) {
        return FlatElement.builder()
                .index(index)
                .id(node.getId())
                .name(node.getName())
                .kind(node.getKind())
                .typeLabel(node.getTypeLabel())
                .path(path)
                .depth(depth)
                .boundingBox(node.getBoundingBox())
                .visible(node.isVisible())
                .textContent(node.getCharacters())
                .componentId(node.getComponentId())
                .instanceProperties(node.getInstanceProperties())
                .childCount(node.getChildren().size())
                .build();
    }
}

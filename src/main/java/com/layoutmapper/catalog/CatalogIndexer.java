package com.layoutmapper.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds a {@link Catalog} from a list of components.
 *
 * Entries without a usable name are skipped and recorded as errors; the remaining
 * entries are indexed in their original order. A later entry whose name collides
 * (case-insensitively) with an earlier one stays in the list but is not reachable by
 * name, and a warning is recorded.
 */
public class CatalogIndexer {
    private static final Logger log = LoggerFactory.getLogger(CatalogIndexer.class);

    public Catalog buildIndex(List<CatalogComponent> components) {
        return buildIndex(components, List.of());
    }

    /**
     * @param decodeErrors problems found while decoding the catalog source, carried into the result
     */
    public Catalog buildIndex(List<CatalogComponent> components, List<String> decodeErrors) {
        Catalog catalog = new Catalog();
        decodeErrors.forEach(catalog::addError);

        int position = 0;
        for (CatalogComponent component : components) {
            position++;
            if (component == null) {
                catalog.addError("Catalog entry #" + position + " is empty");
                log.warn("Skipping empty catalog entry #{}", position);
                continue;
            }
            if (component.getName() == null || component.getName().isBlank()) {
                String ref = component.getId() != null ? " (id " + component.getId() + ")" : "";
                catalog.addError("Catalog entry #" + position + ref + " has no name");
                log.warn("Skipping catalog entry #{}{}: missing name", position, ref);
                continue;
            }
            if (catalog.containsName(component.getName())) {
                catalog.addWarning("Duplicate component name '" + component.getName()
                        + "' at entry #" + position + "; name lookup keeps the first");
                log.warn("Duplicate component name '{}' at entry #{}", component.getName(), position);
            }
            catalog.addComponent(component);
        }

        log.debug("Indexed {} catalog components ({} errors)", catalog.size(), catalog.getErrors().size());
        return catalog;
    }
}

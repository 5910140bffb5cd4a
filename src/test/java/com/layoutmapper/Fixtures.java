package com.layoutmapper;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Locates the JSON fixtures under src/test/resources/fixtures.
 */
public final class Fixtures {

    public static final String LOGIN_FORM = "login-form.json";
    public static final String CATALOG = "catalog.json";
    public static final String DESIGN_SYSTEM = "design-system.json";

    private Fixtures() {
    }

    public static Path path(String name) {
        URL url = Fixtures.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IllegalArgumentException("Missing fixture: " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}

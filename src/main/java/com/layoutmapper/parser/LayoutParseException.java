package com.layoutmapper.parser;

/**
 * Raised when a layout or catalog document violates its structural contract
 * (not JSON, root is not an object, and so on).
 */
public class LayoutParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LayoutParseException(String message) {
        super(message);
    }

    public LayoutParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

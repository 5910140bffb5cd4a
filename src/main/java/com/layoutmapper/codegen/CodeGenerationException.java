package com.layoutmapper.codegen;

/**
 * Raised when the scaffold template cannot be loaded or rendered.
 */
public class CodeGenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

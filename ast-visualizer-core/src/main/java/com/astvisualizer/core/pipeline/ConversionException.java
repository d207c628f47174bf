package com.astvisualizer.core.pipeline;

import java.util.Objects;

/**
 * Thrown when converting an AST dump fails.
 */
public class ConversionException extends Exception {

    private final ConversionError error;

    public ConversionException(ConversionError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public ConversionException(ConversionError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public ConversionError getError() {
        return error;
    }
}

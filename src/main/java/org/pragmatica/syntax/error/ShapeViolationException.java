package org.pragmatica.syntax.error;

/**
 * Thrown when a node is built with children or text that break its shape.
 * Indicates a bug in the calling grammar code, never malformed source input.
 */
public final class ShapeViolationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final transient ShapeError error;

    public ShapeViolationException(ShapeError error) {
        super(error.message());
        this.error = error;
    }

    public ShapeError error() {
        return error;
    }
}

package io.framekit.core;

/**
 * Raised when a label cannot be resolved through an index.
 */
public class KeyNotFoundException extends FrameException {

    private final Object label;

    public KeyNotFoundException(Object label, String message) {
        super(message);
        this.label = label;
    }

    public KeyNotFoundException(Object label) {
        this(label, "label not found in index: " + label);
    }

    public Object label() {
        return label;
    }
}

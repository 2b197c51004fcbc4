package io.framekit.core;

public class InvalidShapeException extends FrameException {

    public InvalidShapeException(String message) {
        super(message);
    }
}

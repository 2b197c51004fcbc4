package io.framekit.core;

public class InvalidArgumentException extends FrameException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}

package io.framekit.core;

/**
 * Base type of every error raised by the table engine.
 */
public class FrameException extends RuntimeException {

    public FrameException(Throwable cause) {
        super(cause);
    }

    public FrameException(String message, Throwable cause) {
        super(message, cause);
    }

    public FrameException(String message) {
        super(message);
    }

}

package io.framekit.core;

public class PositionOutOfBoundsException extends FrameException {

    private final int position;

    public PositionOutOfBoundsException(int position, int length) {
        super("position " + position + " out of bounds for length " + length);
        this.position = position;
    }

    public int position() {
        return position;
    }
}

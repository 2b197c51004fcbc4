package io.framekit.core;

public class ColumnNotFoundException extends FrameException {

    private final String column;

    public ColumnNotFoundException(String column) {
        super("column not found: \"" + column + "\"");
        this.column = column;
    }

    public ColumnNotFoundException(String role, String column) {
        super(role + " column not found: \"" + column + "\"");
        this.column = column;
    }

    public String column() {
        return column;
    }
}

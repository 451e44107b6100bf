package io.tabula.core;

public class ColumnNotFoundException extends TabulaException {

    private final String column;

    public ColumnNotFoundException(String column) {
        super("Column \"" + column + "\" does not exist");
        this.column = column;
    }

    public String column() {
        return column;
    }
}

package io.tabula.frame;

public record Shape(int rows, int columns) {

    @Override
    public String toString() {
        return "(" + rows + ", " + columns + ")";
    }
}

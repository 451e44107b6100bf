package io.tabula.core;

/**
 * Thrown when input handed to a table factory is empty, malformed or inconsistent.
 * No partially built table is ever observable after this exception.
 */
public class TableConstructionException extends TabulaException {

    public TableConstructionException(String message) {
        super(message);
    }

    public TableConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.tabula.kernel;

public enum ValueType {
    NUMBER,
    TEXT,
    NULL,
    OTHER,
    /**
     * Reported for an empty series, which has no first element to take a type from.
     */
    NONE
}

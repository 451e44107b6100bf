package io.tabula.core;

/**
 * Thrown on any attempt to replace a column, a cell or a value of an immutable structure.
 */
public class MutationNotAllowedException extends UnsupportedOperationException {

    public MutationNotAllowedException(String target) {
        super("Direct assignment to " + target + " is not allowed");
    }
}

package io.tabula.core;

/**
 * Root of the failures raised by tabula itself. Positional range errors use the JDK's
 * {@link IndexOutOfBoundsException} and mutation attempts use {@link MutationNotAllowedException}.
 */
public class TabulaException extends RuntimeException {

    public TabulaException(String message) {
        super(message);
    }

    public TabulaException(String message, Throwable cause) {
        super(message, cause);
    }
}

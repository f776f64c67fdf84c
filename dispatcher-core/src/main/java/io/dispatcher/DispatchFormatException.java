package io.dispatcher;

/**
 * Thrown by {@code dispatch} when the supplied value is not a well-formed event
 * or the target namespace is blank. Raised before any handler runs.
 */
public final class DispatchFormatException extends DispatcherException {

    public DispatchFormatException(String message) {
        super(message);
    }
}

package io.dispatcher;

/**
 * Thrown when a subscription is requested without a usable handler.
 * The registry is left untouched.
 */
public final class InvalidHandlerException extends DispatcherException {

    public InvalidHandlerException(String message) {
        super(message);
    }
}

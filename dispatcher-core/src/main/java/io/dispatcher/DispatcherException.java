package io.dispatcher;

/**
 * Base type for every error the dispatcher raises to its caller.
 *
 * <p>Failures thrown by handlers during {@code dispatch} are never wrapped in this
 * type; they are recorded as {@link HandlerError} entries on the returned
 * {@link Notification}.
 */
public class DispatcherException extends RuntimeException {

    public DispatcherException(String message) {
        super(message);
    }

    public DispatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.dispatcher;

import java.util.List;

/**
 * Raised by {@link Notification#requireSuccess()} for callers that want handler
 * failures surfaced as an exception rather than inspected as data.
 *
 * <p>The first handler failure is attached as the cause; the others are added as
 * suppressed exceptions.
 */
public final class DispatchFailedException extends DispatcherException {

    private final transient Notification notification;

    public DispatchFailedException(Notification notification) {
        super(describe(notification), firstCause(notification.errors()));
        this.notification = notification;
        List<HandlerError> errors = notification.errors();
        for (int i = 1; i < errors.size(); i++) {
            Throwable cause = errors.get(i).cause();
            if (cause != null) {
                addSuppressed(cause);
            }
        }
    }

    public Notification notification() {
        return notification;
    }

    private static String describe(Notification notification) {
        StringBuilder sb = new StringBuilder()
            .append("Dispatch of event '").append(notification.event().code())
            .append("' in namespace '").append(notification.namespace())
            .append("' failed with ").append(notification.errors().size()).append(" error(s)");
        for (HandlerError error : notification.errors()) {
            sb.append("; ").append(error.handlerName()).append(": ").append(error.message());
        }
        return sb.toString();
    }

    private static Throwable firstCause(List<HandlerError> errors) {
        return errors.isEmpty() ? null : errors.get(0).cause();
    }
}

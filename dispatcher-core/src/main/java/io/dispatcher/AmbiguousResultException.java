package io.dispatcher;

/**
 * Thrown by {@link Notification#getOneAndOnlyResult()} when the notification does
 * not hold exactly one result.
 */
public final class AmbiguousResultException extends DispatcherException {

    private final int resultCount;

    public AmbiguousResultException(int resultCount) {
        super("Expected exactly one result but found " + resultCount);
        this.resultCount = resultCount;
    }

    public int resultCount() {
        return resultCount;
    }
}

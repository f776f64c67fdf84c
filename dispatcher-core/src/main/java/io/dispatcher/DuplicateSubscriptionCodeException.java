package io.dispatcher;

/**
 * Thrown when a subscription code is already present in the registry.
 *
 * <p>Only reachable with a broken {@link io.dispatcher.spi.IdGenerator}; treat it as an
 * internal consistency failure.
 */
public final class DuplicateSubscriptionCodeException extends DispatcherException {

    private final String code;

    public DuplicateSubscriptionCodeException(String code) {
        super("Subscription code already registered: " + code);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

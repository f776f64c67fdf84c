package io.dispatcher;

/**
 * Thrown when a removal or lookup targets a subscription that does not exist.
 * Registry state is unchanged when this is raised.
 */
public final class SubscriptionNotFoundException extends DispatcherException {

    public SubscriptionNotFoundException(String message) {
        super(message);
    }

    public static SubscriptionNotFoundException forCode(String code) {
        return new SubscriptionNotFoundException("No subscription with code: " + code);
    }
}

package io.dispatcher.spi;

/**
 * Source of identifiers for events, subscriptions and notifications.
 *
 * <p>Implementations must never repeat a value for the lifetime of the dispatcher
 * that uses them and must be safe to call from multiple threads.
 *
 * @see io.dispatcher.util.UlidIdGenerator
 */
public interface IdGenerator {

    /**
     * Returns the next process-unique numeric id.
     */
    long nextId();

    /**
     * Returns the next globally unique string code.
     */
    String nextCode();
}

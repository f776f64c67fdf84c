package io.dispatcher.registry;

import io.dispatcher.DuplicateSubscriptionCodeException;
import io.dispatcher.EventHandler;
import io.dispatcher.Subscription;
import io.dispatcher.SubscriptionNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Holds the live subscriptions of one dispatcher and answers matching queries.
 *
 * <p>Implementations must keep their lookups mutually consistent under concurrent
 * mutation, and every returned list must be an unmodifiable snapshot in registration
 * order. Handler matching uses {@link Object#equals(Object)}.
 *
 * @see DefaultSubscriptionRegistry
 */
public interface SubscriptionRegistry {

    /**
     * Adds a subscription.
     *
     * @throws DuplicateSubscriptionCodeException if the code is already present
     */
    void add(Subscription subscription);

    /**
     * Removes the subscription with the given code.
     *
     * @return the removed subscription
     * @throws SubscriptionNotFoundException if no subscription has that code
     */
    Subscription removeByCode(String code);

    /**
     * Removes the earliest registered subscription bound to exactly this namespace,
     * event code and handler.
     *
     * @return the removed subscription, or empty if none matched
     */
    Optional<Subscription> remove(String namespace, String eventCode, EventHandler handler);

    /**
     * Removes every subscription of {@code handler} in any namespace.
     *
     * @return the removed subscriptions, empty if none matched
     */
    List<Subscription> removeByHandler(EventHandler handler);

    /**
     * Removes every subscription of {@code handler} in {@code namespace}.
     *
     * @return the removed subscriptions, empty if none matched
     */
    List<Subscription> removeByHandler(EventHandler handler, String namespace);

    List<Subscription> removeByNamespace(String namespace);

    /**
     * Removes every subscription bound to {@code eventCode}, in any namespace.
     * Namespace-wide subscriptions are not affected.
     */
    List<Subscription> removeByEvent(String eventCode);

    /**
     * Removes everything.
     *
     * @return the number of subscriptions removed
     */
    int removeAll();

    /**
     * Returns the subscriptions an event with {@code eventCode} dispatched to
     * {@code namespace} reaches: exact matches and namespace-wide subscriptions,
     * in registration order.
     */
    List<Subscription> find(String namespace, String eventCode);

    Optional<Subscription> findByCode(String code);

    List<Subscription> findByHandler(EventHandler handler);

    List<Subscription> findByNamespace(String namespace);

    /**
     * Returns subscriptions bound to {@code eventCode} across all namespaces.
     */
    List<Subscription> findByEvent(String eventCode);

    /**
     * Returns every live subscription.
     */
    List<Subscription> findAll();

    boolean contains(String code);

    int size();

    /**
     * Returns the namespaces that currently hold at least one subscription.
     */
    List<String> namespaces();
}

/**
 * Subscription storage keyed by namespace, event code and subscription code.
 *
 * @see io.dispatcher.registry.SubscriptionRegistry
 * @see io.dispatcher.registry.DefaultSubscriptionRegistry
 */
package io.dispatcher.registry;

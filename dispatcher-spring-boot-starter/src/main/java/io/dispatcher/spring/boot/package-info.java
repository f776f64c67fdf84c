/**
 * Spring Boot auto-configuration for the dispatcher.
 *
 * <p>Provides a {@link io.dispatcher.dispatch.Dispatcher} bean configured from
 * {@code dispatcher.*} properties, optional Micrometer metrics, and subscription of
 * {@link io.dispatcher.spring.boot.EventSubscriber @EventSubscriber} beans.
 */
package io.dispatcher.spring.boot;

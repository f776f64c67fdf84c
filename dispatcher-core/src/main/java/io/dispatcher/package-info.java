/**
 * Root API for the dispatcher: an in-process, namespaced publish/subscribe core.
 *
 * <h2>Core Design</h2>
 * <p>Handlers subscribe to a {@linkplain io.dispatcher.Subscription namespace and event code}
 * on a {@linkplain io.dispatcher.dispatch.Dispatcher dispatcher}. Dispatching an
 * {@link io.dispatcher.Event} runs every matching handler synchronously, highest priority
 * first, and returns one immutable {@link io.dispatcher.Notification} holding each
 * handler's result and every captured failure. Handler exceptions are data, not control
 * flow: one failing handler never prevents delivery to the rest.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Dispatcher dispatcher = Dispatcher.create();
 * dispatcher.subscribeAll(EventHandler.named("h1",
 *     (event, args) -> "Hello, " + event.get("name") + "!"), "greet");
 *
 * Notification n = dispatcher.dispatch(
 *     Event.builder("greeting_event").put("name", "Alice").build(), "greet");
 * n.get("h1"); // "Hello, Alice!"
 * }</pre>
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>dispatcher-core</b>: events, subscriptions, registry, dispatcher</li>
 *   <li><b>dispatcher-micrometer</b>: Micrometer-backed metrics exporter</li>
 *   <li><b>dispatcher-spring-boot-starter</b>: auto-configuration and
 *       annotation-driven subscription</li>
 * </ul>
 *
 * @see io.dispatcher.dispatch.Dispatcher
 * @see io.dispatcher.Event
 * @see io.dispatcher.EventHandler
 * @see io.dispatcher.Notification
 */
package io.dispatcher;

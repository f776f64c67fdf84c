package io.dispatcher.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a dispatcher subscriber.
 *
 * <p>The annotated bean must implement {@link io.dispatcher.EventHandler}. It is
 * subscribed once all singletons are instantiated.
 *
 * <pre>{@code
 * @Component
 * @EventSubscriber(event = "order_placed", namespace = "orders", priority = 10, name = "audit")
 * public class AuditHandler implements EventHandler {
 *   public Object handle(Event event, DispatchArguments args) { ... }
 * }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>an empty {@code event} subscribes to every event of the namespace</li>
 *   <li>an empty {@code namespace} uses {@code dispatcher.default-namespace}</li>
 *   <li>a non-empty {@code name} keys the handler's results; otherwise the handler's
 *       own {@link io.dispatcher.EventHandler#name() name} is used</li>
 * </ul>
 *
 * @see EventSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventSubscriber {

    /**
     * Event code to match. Empty means every event in the namespace.
     */
    String event() default "";

    /**
     * Namespace to subscribe in. Empty means the dispatcher's default namespace.
     */
    String namespace() default "";

    int priority() default 0;

    boolean persistent() default false;

    /**
     * Name the handler's results are keyed by.
     */
    String name() default "";
}

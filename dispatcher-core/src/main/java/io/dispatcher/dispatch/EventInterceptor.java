package io.dispatcher.dispatch;

import io.dispatcher.Event;
import io.dispatcher.Notification;

/**
 * Cross-cutting hook around each dispatch call.
 *
 * <p>Interceptors run around handler invocation:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>matching handlers, by priority</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, no handler runs and the returned notification
 * carries the failure as an error. Only interceptors whose {@code beforeDispatch}
 * completed see {@code afterDispatch}. {@code afterDispatch} exceptions are logged
 * and ignored.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Dispatcher.builder()
 *     .interceptor(EventInterceptor.before((event, namespace) ->
 *         audit.log(namespace, event.code())))
 *     .interceptor(EventInterceptor.after(notification -> {
 *         if (notification.hasErrors()) alerts.raise(notification);
 *     }))
 *     .build();
 * }</pre>
 */
public interface EventInterceptor {

    /**
     * Called before any handler is invoked.
     *
     * @param event     the event about to be dispatched
     * @param namespace the target namespace
     * @throws Exception to skip every handler and fail the dispatch
     */
    default void beforeDispatch(Event event, String namespace) throws Exception {
    }

    /**
     * Called with the finished notification.
     *
     * @param notification the outcome of the dispatch
     */
    default void afterDispatch(Notification notification) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static EventInterceptor before(BeforeHook hook) {
        return new EventInterceptor() {
            @Override
            public void beforeDispatch(Event event, String namespace) throws Exception {
                hook.accept(event, namespace);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static EventInterceptor after(AfterHook hook) {
        return new EventInterceptor() {
            @Override
            public void afterDispatch(Notification notification) {
                hook.accept(notification);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Event event, String namespace) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Notification notification);
    }
}

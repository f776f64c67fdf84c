package io.dispatcher;

import java.util.Objects;

/**
 * Callback invoked by the dispatcher for every matching subscription.
 *
 * <p>The return value is stored in the resulting {@link Notification}'s content under
 * {@link #name()}. Any exception thrown is captured as a {@link HandlerError}; it never
 * escapes {@code dispatch} and never stops the remaining handlers from running.
 *
 * <pre>{@code
 * EventHandler greet = EventHandler.named("h1",
 *     (event, args) -> "Hello, " + event.get("name") + "!");
 * }</pre>
 *
 * @see Subscription
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles a dispatched event.
     *
     * @param event     the dispatched event
     * @param arguments extra positional and keyword arguments passed to {@code dispatch}
     * @return a result to record in the notification, may be {@code null}
     * @throws Exception to record a failure for this handler
     */
    Object handle(Event event, DispatchArguments arguments) throws Exception;

    /**
     * Returns the name this handler's result is keyed by.
     * Defaults to the implementing class name.
     */
    default String name() {
        return getClass().getName();
    }

    /**
     * Gives a handler an explicit name. Lambdas should always be wrapped this way,
     * since their synthetic class names are not stable.
     *
     * @param name     the handler name
     * @param delegate the handler to invoke
     * @return a named handler
     */
    static EventHandler named(String name, EventHandler delegate) {
        return new Named(name, delegate);
    }

    /**
     * Named wrapper. Equality covers both the name and the wrapped handler, so the
     * same wrapper instance, or an equal one, can be used to unsubscribe.
     */
    record Named(String name, EventHandler delegate) implements EventHandler {
        public Named {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(delegate, "delegate");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name cannot be blank");
            }
        }

        @Override
        public Object handle(Event event, DispatchArguments arguments) throws Exception {
            return delegate.handle(event, arguments);
        }
    }
}

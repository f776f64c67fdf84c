package io.dispatcher.dispatch;

import io.dispatcher.ConfigurationException;
import io.dispatcher.DispatchArguments;
import io.dispatcher.DispatchFormatException;
import io.dispatcher.Event;
import io.dispatcher.EventHandler;
import io.dispatcher.HandlerError;
import io.dispatcher.InvalidHandlerException;
import io.dispatcher.Namespaces;
import io.dispatcher.Notification;
import io.dispatcher.Subscription;
import io.dispatcher.SubscriptionNotFoundException;
import io.dispatcher.registry.DefaultSubscriptionRegistry;
import io.dispatcher.registry.SubscriptionRegistry;
import io.dispatcher.spi.IdGenerator;
import io.dispatcher.spi.MetricsExporter;
import io.dispatcher.util.UlidIdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Public entry point for subscribing handlers and dispatching events to them.
 *
 * <p>A dispatch runs every subscription matching {@code (namespace, event.code())},
 * plus every namespace-wide subscription of that namespace, on the calling thread.
 * Handlers run by descending priority; equal priorities run in registration order.
 * A failing handler never stops the others: its exception is recorded in the returned
 * {@link Notification} and {@code dispatch} returns normally.
 *
 * <p>Create instances via {@link #builder()} or {@link #create()}. Each dispatcher owns
 * its own {@link SubscriptionRegistry}; there is no process-wide state.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dispatcher dispatcher = Dispatcher.create();
 *
 * String code = dispatcher.subscribe("order_placed",
 *     EventHandler.named("audit", (event, args) -> audit.record(event)),
 *     "orders", false, 10);
 *
 * Notification n = dispatcher.dispatch(Event.of("order_placed"), "orders");
 * dispatcher.unsubscribeByCode(code);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods may be called concurrently. The registry lock is never held while a
 * handler runs, so handlers may subscribe, unsubscribe or dispatch re-entrantly.
 * A subscription added or removed during an in-flight dispatch may or may not be
 * seen by that dispatch.
 *
 * @see Dispatcher.Builder
 * @see Notification
 */
public final class Dispatcher {
  private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

  // List.sort is stable, so equal priorities keep registration order
  private static final Comparator<Subscription> BY_PRIORITY_DESC =
      Comparator.comparingInt(Subscription::priority).reversed();

  private final SubscriptionRegistry registry;
  private final IdGenerator idGenerator;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final List<EventInterceptor> interceptors;
  private final String defaultNamespace;

  private Dispatcher(Builder builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultSubscriptionRegistry();
    this.idGenerator = builder.idGenerator != null ? builder.idGenerator : new UlidIdGenerator();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.defaultNamespace = requireText(builder.defaultNamespace, "defaultNamespace");
    this.metrics.bindSubscriptionCount(this.registry::size);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a dispatcher with every collaborator at its default.
   */
  public static Dispatcher create() {
    return builder().build();
  }

  public String defaultNamespace() {
    return defaultNamespace;
  }

  // ── Subscribe ──────────────────────────────────────────────

  public String subscribe(String eventCode, EventHandler handler) {
    return subscribe(eventCode, handler, defaultNamespace, false, 0);
  }

  public String subscribe(String eventCode, EventHandler handler, String namespace) {
    return subscribe(eventCode, handler, namespace, false, 0);
  }

  /**
   * Subscribes {@code handler} to events with {@code eventCode} dispatched to {@code namespace}.
   *
   * @param eventCode  the event code to match, or {@link Subscription#ANY_EVENT}
   * @param handler    the handler to invoke
   * @param namespace  the namespace to listen in
   * @param persistent advisory flag, stored but not acted upon
   * @param priority   higher runs earlier
   * @return the new subscription's code, the handle for {@link #unsubscribeByCode}
   * @throws InvalidHandlerException  if {@code handler} is null or has no name
   * @throws IllegalArgumentException if the event code or namespace is blank
   */
  public String subscribe(String eventCode, EventHandler handler, String namespace,
      boolean persistent, int priority) {
    requireHandler(handler);
    requireText(eventCode, "eventCode");
    requireText(namespace, "namespace");
    return register(eventCode, handler, namespace, persistent, priority);
  }

  public String subscribe(Event event, EventHandler handler) {
    return subscribe(event, handler, defaultNamespace, false, 0);
  }

  public String subscribe(Event event, EventHandler handler, String namespace) {
    return subscribe(event, handler, namespace, false, 0);
  }

  /**
   * Same as {@link #subscribe(String, EventHandler, String, boolean, int)}, matching on
   * the event's code.
   */
  public String subscribe(Event event, EventHandler handler, String namespace,
      boolean persistent, int priority) {
    requireHandler(handler);
    Objects.requireNonNull(event, "event");
    return subscribe(event.code(), handler, namespace, persistent, priority);
  }

  /**
   * Subscribes {@code handler} to every event of the default namespace.
   */
  public String subscribeAll(EventHandler handler) {
    return subscribeAll(handler, defaultNamespace, false, 0);
  }

  public String subscribeAll(EventHandler handler, String namespace) {
    return subscribeAll(handler, namespace, false, 0);
  }

  /**
   * Subscribes {@code handler} to every event dispatched to {@code namespace}.
   */
  public String subscribeAll(EventHandler handler, String namespace, boolean persistent, int priority) {
    return subscribe(Subscription.ANY_EVENT, handler, namespace, persistent, priority);
  }

  /**
   * Subscribes several handlers at once.
   *
   * <p>Malformed input (missing events or handlers, a per-item list whose length differs
   * from the events, a value given both as scalar and as list) is rejected before
   * anything is subscribed. After that, items are validated and applied one at a time:
   * an invalid item fails the call with its index in the message, and items before it
   * stay subscribed.
   *
   * @return the new codes, in event order
   * @throws ConfigurationException  on malformed input or an invalid event code,
   *                                 namespace or flag at some index
   * @throws InvalidHandlerException if the handler at some index is null or has no name
   */
  public List<String> bulkSubscribe(BulkSubscription bulk) {
    Objects.requireNonNull(bulk, "bulk");
    List<String> eventCodes = bulk.eventCodes();
    if (eventCodes == null) {
      throw new ConfigurationException("Bulk subscription requires events");
    }
    int size = eventCodes.size();
    requireOneOf("handler", bulk.handler(), "handlers", bulk.handlers(), true);
    requireOneOf("namespace", bulk.namespace(), "namespaces", bulk.namespaces(), false);
    requireOneOf("persistent", bulk.persistent(), "persistents", bulk.persistents(), false);
    requireOneOf("priority", bulk.priority(), "priorities", bulk.priorities(), false);
    requireLength("handlers", bulk.handlers(), size);
    requireLength("namespaces", bulk.namespaces(), size);
    requireLength("persistents", bulk.persistents(), size);
    requireLength("priorities", bulk.priorities(), size);

    List<String> codes = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      EventHandler handler = pick(bulk.handler(), bulk.handlers(), i, null);
      if (handler == null) {
        throw new InvalidHandlerException("Handler at index " + i + " is null; "
            + codes.size() + " subscription(s) already applied");
      }
      String name = handler.name();
      if (name == null || name.isBlank()) {
        throw new InvalidHandlerException("Handler at index " + i + " has no name; "
            + codes.size() + " subscription(s) already applied");
      }
      String eventCode = eventCodes.get(i);
      String namespace = pick(bulk.namespace(), bulk.namespaces(), i, defaultNamespace);
      Boolean persistent = pick(bulk.persistent(), bulk.persistents(), i, Boolean.FALSE);
      Integer priority = pick(bulk.priority(), bulk.priorities(), i, 0);
      if (eventCode == null || eventCode.isBlank()) {
        throw bulkItemError(i, "event code is blank", codes.size());
      }
      if (namespace == null || namespace.isBlank()) {
        throw bulkItemError(i, "namespace is blank", codes.size());
      }
      if (persistent == null) {
        throw bulkItemError(i, "persistent flag is null", codes.size());
      }
      if (priority == null) {
        throw bulkItemError(i, "priority is null", codes.size());
      }
      codes.add(register(eventCode, handler, namespace, persistent, priority));
    }
    return Collections.unmodifiableList(codes);
  }

  private String register(String eventCode, EventHandler handler, String namespace,
      boolean persistent, int priority) {
    Subscription subscription = Subscription.builder()
        .code(idGenerator.nextCode())
        .eventCode(eventCode)
        .handler(handler)
        .namespace(namespace)
        .persistent(persistent)
        .priority(priority)
        .build();
    registry.add(subscription);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Subscribed " + subscription);
    }
    return subscription.code();
  }

  // ── Unsubscribe ────────────────────────────────────────────

  public Subscription unsubscribe(String eventCode, EventHandler handler) {
    return unsubscribe(eventCode, handler, defaultNamespace);
  }

  /**
   * Removes the earliest subscription of {@code handler} to {@code eventCode} in
   * {@code namespace}.
   *
   * @return the removed subscription
   * @throws SubscriptionNotFoundException if no subscription matches
   */
  public Subscription unsubscribe(String eventCode, EventHandler handler, String namespace) {
    Objects.requireNonNull(handler, "handler");
    Subscription removed = registry.remove(namespace, eventCode, handler)
        .orElseThrow(() -> new SubscriptionNotFoundException("No subscription of handler '"
            + handler.name() + "' to event '" + eventCode + "' in namespace '" + namespace + "'"));
    afterRemoval(List.of(removed));
    return removed;
  }

  public Subscription unsubscribe(Event event, EventHandler handler) {
    return unsubscribe(event, handler, defaultNamespace);
  }

  public Subscription unsubscribe(Event event, EventHandler handler, String namespace) {
    Objects.requireNonNull(event, "event");
    return unsubscribe(event.code(), handler, namespace);
  }

  /**
   * Removes the subscription with the given code.
   *
   * @throws SubscriptionNotFoundException if the code is unknown or already removed
   */
  public Subscription unsubscribeByCode(String code) {
    Subscription removed = registry.removeByCode(code);
    afterRemoval(List.of(removed));
    return removed;
  }

  /**
   * Removes every subscription of {@code handler}. Removing nothing is not an error.
   */
  public List<Subscription> unsubscribeByFunction(EventHandler handler) {
    return afterRemoval(registry.removeByHandler(handler));
  }

  public List<Subscription> unsubscribeByFunction(EventHandler handler, String namespace) {
    return afterRemoval(registry.removeByHandler(handler, namespace));
  }

  public List<Subscription> unsubscribeByNamespace(String namespace) {
    return afterRemoval(registry.removeByNamespace(namespace));
  }

  /**
   * Removes every subscription bound to {@code eventCode} in any namespace.
   * Namespace-wide subscriptions stay.
   */
  public List<Subscription> unsubscribeByEvent(String eventCode) {
    return afterRemoval(registry.removeByEvent(eventCode));
  }

  public List<Subscription> unsubscribeByEvent(Event event) {
    Objects.requireNonNull(event, "event");
    return unsubscribeByEvent(event.code());
  }

  /**
   * Removes every subscription.
   *
   * @return the number removed
   */
  public int unsubscribeAll() {
    int removed = registry.removeAll();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Removed all " + removed + " subscription(s)");
    }
    return removed;
  }

  private List<Subscription> afterRemoval(List<Subscription> removed) {
    if (!removed.isEmpty() && logger.isLoggable(Level.FINE)) {
      logger.fine("Unsubscribed " + removed.size() + " subscription(s): " + removed);
    }
    return removed;
  }

  // ── Queries ────────────────────────────────────────────────

  /**
   * Returns subscriptions bound to {@code eventCode} in any namespace.
   */
  public List<Subscription> getSubscriptionsByEvent(String eventCode) {
    return registry.findByEvent(eventCode);
  }

  /**
   * Returns the subscriptions a dispatch of {@code eventCode} to {@code namespace} would
   * reach, namespace-wide ones included, in registration order.
   */
  public List<Subscription> getSubscriptionsByEvent(String eventCode, String namespace) {
    return registry.find(namespace, eventCode);
  }

  public List<Subscription> getSubscriptionsByFunction(EventHandler handler) {
    return registry.findByHandler(handler);
  }

  public List<Subscription> getSubscriptionsByNamespace(String namespace) {
    return registry.findByNamespace(namespace);
  }

  /**
   * @throws SubscriptionNotFoundException if no subscription has that code
   */
  public Subscription getSubscriptionByCode(String code) {
    return registry.findByCode(code)
        .orElseThrow(() -> SubscriptionNotFoundException.forCode(code));
  }

  /**
   * Returns subscriptions flagged persistent, for an external reloader.
   */
  public List<Subscription> getPersistentSubscriptions() {
    List<Subscription> persistent = new ArrayList<>();
    for (Subscription subscription : registry.findAll()) {
      if (subscription.persistent()) {
        persistent.add(subscription);
      }
    }
    return Collections.unmodifiableList(persistent);
  }

  public List<Subscription> getSubscriptions() {
    return registry.findAll();
  }

  public int subscriptionCount() {
    return registry.size();
  }

  // ── Dispatch ───────────────────────────────────────────────

  public Notification dispatch(Event event) {
    return dispatch(event, defaultNamespace, DispatchArguments.none());
  }

  public Notification dispatch(Event event, String namespace) {
    return dispatch(event, namespace, DispatchArguments.none());
  }

  public Notification dispatch(Event event, DispatchArguments arguments) {
    return dispatch(event, defaultNamespace, arguments);
  }

  /**
   * Runs every handler matching the event in {@code namespace} and collects the outcome.
   *
   * <p>No matching subscription is not an error: the notification is {@code SUCCESS}
   * with empty content.
   *
   * @param event     the event to deliver
   * @param namespace the target namespace
   * @param arguments extra arguments handed to each handler; {@code null} means none
   * @return the notification; {@code FAILURE} if any handler or interceptor failed
   * @throws DispatchFormatException if {@code event} is null or {@code namespace} is blank
   */
  public Notification dispatch(Event event, String namespace, DispatchArguments arguments) {
    if (event == null) {
      throw new DispatchFormatException("Cannot dispatch a null event");
    }
    if (namespace == null || namespace.isBlank()) {
      throw new DispatchFormatException("Cannot dispatch event '" + event.code() + "' to a blank namespace");
    }
    DispatchArguments args = arguments != null ? arguments : DispatchArguments.none();

    Notification.Builder outcome = Notification.builder()
        .id(idGenerator.nextId())
        .event(event)
        .namespace(namespace)
        .start(clock.instant());

    int completedBefore = runBeforeDispatch(event, namespace, outcome);
    if (completedBefore == interceptors.size()) {
      List<Subscription> matched = new ArrayList<>(registry.find(namespace, event.code()));
      matched.sort(BY_PRIORITY_DESC);
      for (Subscription subscription : matched) {
        invoke(subscription, event, args, outcome);
      }
    }

    Instant end = clock.instant();
    Notification notification = outcome.end(end).build();
    runAfterDispatch(notification, completedBefore);

    if (notification.hasErrors()) {
      metrics.incrementDispatchFailure();
    } else {
      metrics.incrementDispatchSuccess();
    }
    metrics.recordDispatchDurationMs(notification.duration().toMillis());
    return notification;
  }

  private void invoke(Subscription subscription, Event event, DispatchArguments args,
      Notification.Builder outcome) {
    EventHandler handler = subscription.handler();
    String name = nameOf(handler);
    long startNanos = System.nanoTime();
    try {
      Object value = handler.handle(event, args);
      outcome.result(name, value);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Handler '" + name + "' failed for event '"
          + event.code() + "' in namespace '" + subscription.namespace() + "'", e);
      outcome.error(HandlerError.of(subscription, name, e));
      metrics.incrementHandlerFailure();
    } finally {
      metrics.incrementHandlerInvocation();
      metrics.recordHandlerDurationMs(
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
  }

  // Returns how many interceptors completed beforeDispatch.
  private int runBeforeDispatch(Event event, String namespace, Notification.Builder outcome) {
    for (int i = 0; i < interceptors.size(); i++) {
      EventInterceptor interceptor = interceptors.get(i);
      try {
        interceptor.beforeDispatch(event, namespace);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Interceptor beforeDispatch failed for event '"
            + event.code() + "' in namespace '" + namespace + "'; no handler will run", e);
        outcome.error(new HandlerError(null, interceptor.getClass().getName(), namespace, null, e));
        return i;
      }
    }
    return interceptors.size();
  }

  private void runAfterDispatch(Notification notification, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(notification);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  // ── Validation ─────────────────────────────────────────────

  private static void requireHandler(EventHandler handler) {
    if (handler == null) {
      throw new InvalidHandlerException("Handler must not be null");
    }
    String name = handler.name();
    if (name == null || name.isBlank()) {
      throw new InvalidHandlerException("Handler " + handler.getClass().getName()
          + " has no name; results are keyed by it");
    }
  }

  // name() is checked at subscribe time but may change afterwards
  private static String nameOf(EventHandler handler) {
    String name = handler.name();
    return name == null || name.isBlank() ? handler.getClass().getName() : name;
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value;
  }

  private static void requireOneOf(String scalarName, Object scalar, String listName, List<?> list,
      boolean required) {
    if (scalar != null && list != null) {
      throw new ConfigurationException("Set either " + scalarName + " or " + listName + ", not both");
    }
    if (required && scalar == null && list == null) {
      throw new ConfigurationException("Bulk subscription requires " + scalarName + " or " + listName);
    }
  }

  private static void requireLength(String name, List<?> list, int expected) {
    if (list != null && list.size() != expected) {
      throw new ConfigurationException(name + " has " + list.size()
          + " element(s) but events has " + expected);
    }
  }

  private static <T> T pick(T scalar, List<T> list, int index, T fallback) {
    if (list != null) {
      return list.get(index);
    }
    return scalar != null ? scalar : fallback;
  }

  private static ConfigurationException bulkItemError(int index, String reason, int applied) {
    return new ConfigurationException("Invalid bulk subscription at index " + index + ": "
        + reason + "; " + applied + " subscription(s) already applied");
  }

  /** Builder for {@link Dispatcher}. */
  public static final class Builder {
    private SubscriptionRegistry registry;
    private IdGenerator idGenerator;
    private Clock clock;
    private MetricsExporter metrics;
    private final List<EventInterceptor> interceptors = new ArrayList<>();
    private String defaultNamespace = Namespaces.GLOBAL;

    private Builder() {}

    /**
     * Sets the registry holding subscriptions.
     *
     * <p>Optional. Defaults to a new {@link DefaultSubscriptionRegistry}. A registry must
     * not be shared between dispatchers.
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the generator for subscription codes and notification ids.
     *
     * <p>Optional. Defaults to a new {@link UlidIdGenerator}.
     *
     * @param idGenerator the id generator
     * @return this builder
     */
    public Builder idGenerator(IdGenerator idGenerator) {
      this.idGenerator = idGenerator;
      return this;
    }

    /**
     * Sets the clock for notification start and end times.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds an interceptor. Interceptors run in the order added.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<EventInterceptor> interceptors) {
      for (EventInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets the namespace used when none is given.
     *
     * <p>Optional. Defaults to {@link Namespaces#GLOBAL}.
     *
     * @param defaultNamespace the default namespace
     * @return this builder
     */
    public Builder defaultNamespace(String defaultNamespace) {
      this.defaultNamespace = defaultNamespace;
      return this;
    }

    public Dispatcher build() {
      return new Dispatcher(this);
    }
  }
}

package io.dispatcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable outcome of a single {@code dispatch} call.
 *
 * <p>{@link #content()} maps each successful handler's {@linkplain EventHandler#name() name}
 * to its return value, in invocation order. When two handlers share a name the later
 * result replaces the earlier one. {@link #errors()} lists every captured failure.
 * The status is {@link NotificationStatus#FAILURE} exactly when errors is non-empty.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Notification n = dispatcher.dispatch(event, "greet");
 * if (n.hasErrors()) {
 *     n.errors().forEach(e -> log.warning(e.handlerName() + ": " + e.message()));
 * }
 * String greeting = (String) n.getOneAndOnlyResult();
 * }</pre>
 */
public final class Notification {

  private final long id;
  private final Event event;
  private final String namespace;
  private final Instant start;
  private final Instant end;
  private final Duration duration;
  private final NotificationStatus status;
  private final Map<String, Object> content;
  private final List<HandlerError> errors;

  private Notification(Builder builder) {
    this.id = builder.id;
    this.event = Objects.requireNonNull(builder.event, "event");
    this.namespace = Objects.requireNonNull(builder.namespace, "namespace");
    this.start = Objects.requireNonNull(builder.start, "start");
    this.end = builder.end == null ? builder.start : builder.end;
    Duration elapsed = Duration.between(start, end);
    this.duration = elapsed.isNegative() ? Duration.ZERO : elapsed;
    // handlers may return null; Map.copyOf would reject it
    this.content = Collections.unmodifiableMap(new LinkedHashMap<>(builder.content));
    this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    this.status = errors.isEmpty() ? NotificationStatus.SUCCESS : NotificationStatus.FAILURE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public long id() {
    return id;
  }

  public Event event() {
    return event;
  }

  public String namespace() {
    return namespace;
  }

  public Instant start() {
    return start;
  }

  public Instant end() {
    return end;
  }

  /**
   * Returns {@code end - start}, never negative.
   */
  public Duration duration() {
    return duration;
  }

  public NotificationStatus status() {
    return status;
  }

  public boolean isSuccess() {
    return status == NotificationStatus.SUCCESS;
  }

  public Map<String, Object> content() {
    return content;
  }

  public List<HandlerError> errors() {
    return errors;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /**
   * Returns the single handler result.
   *
   * @throws AmbiguousResultException if content holds zero or more than one entry
   */
  public Object getOneAndOnlyResult() {
    if (content.size() != 1) {
      throw new AmbiguousResultException(content.size());
    }
    return content.values().iterator().next();
  }

  /**
   * Returns the names of handlers that produced a result, in invocation order.
   */
  public List<String> functionNames() {
    return List.copyOf(content.keySet());
  }

  /**
   * Returns handler results in invocation order. May contain {@code null}.
   */
  public List<Object> functionResults() {
    return Collections.unmodifiableList(new ArrayList<>(content.values()));
  }

  public boolean contains(String handlerName) {
    return content.containsKey(handlerName);
  }

  /**
   * Returns the result recorded for {@code handlerName}.
   *
   * @throws NoSuchElementException if no handler of that name produced a result
   */
  public Object get(String handlerName) {
    if (!content.containsKey(handlerName)) {
      throw new NoSuchElementException("No result for handler: " + handlerName);
    }
    return content.get(handlerName);
  }

  /**
   * Returns this notification if it succeeded.
   *
   * @throws DispatchFailedException if any handler failed
   */
  public Notification requireSuccess() {
    if (hasErrors()) {
      throw new DispatchFailedException(this);
    }
    return this;
  }

  @Override
  public String toString() {
    return "Notification{id=" + id + ", event=" + event.code() + ", namespace='" + namespace
        + "', status=" + status + ", results=" + content.size() + ", errors=" + errors.size()
        + ", duration=" + duration + "}";
  }

  /** Builder for {@link Notification}. */
  public static final class Builder {
    private long id;
    private Event event;
    private String namespace;
    private Instant start;
    private Instant end;
    private final Map<String, Object> content = new LinkedHashMap<>();
    private final List<HandlerError> errors = new ArrayList<>();

    private Builder() {}

    public Builder id(long id) {
      this.id = id;
      return this;
    }

    public Builder event(Event event) {
      this.event = event;
      return this;
    }

    public Builder namespace(String namespace) {
      this.namespace = namespace;
      return this;
    }

    public Builder start(Instant start) {
      this.start = start;
      return this;
    }

    /**
     * Optional. Defaults to the start time.
     */
    public Builder end(Instant end) {
      this.end = end;
      return this;
    }

    /**
     * Records a handler result. A later result under the same name replaces the earlier one.
     */
    public Builder result(String handlerName, Object value) {
      content.put(Objects.requireNonNull(handlerName, "handlerName"), value);
      return this;
    }

    public Builder error(HandlerError error) {
      errors.add(Objects.requireNonNull(error, "error"));
      return this;
    }

    public Notification build() {
      return new Notification(this);
    }
  }
}

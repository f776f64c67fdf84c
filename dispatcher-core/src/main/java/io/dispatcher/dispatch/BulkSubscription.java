package io.dispatcher.dispatch;

import io.dispatcher.Event;
import io.dispatcher.EventHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input for {@link Dispatcher#bulkSubscribe(BulkSubscription)}.
 *
 * <p>The event list is primary. Every other attribute is given either as a single value
 * broadcast to every event, or as a list zipped with the events by position. A list whose
 * length differs from the event list is rejected before anything is subscribed.
 *
 * <pre>{@code
 * dispatcher.bulkSubscribe(BulkSubscription.builder()
 *     .eventCodes(List.of("e1", "e2"))
 *     .handlers(List.of(h1, h2))
 *     .namespace("orders")
 *     .priorities(List.of(0, 10))
 *     .build());
 * }</pre>
 */
public final class BulkSubscription {

  private final List<String> eventCodes;
  private final EventHandler handler;
  private final List<EventHandler> handlers;
  private final String namespace;
  private final List<String> namespaces;
  private final Boolean persistent;
  private final List<Boolean> persistents;
  private final Integer priority;
  private final List<Integer> priorities;

  private BulkSubscription(Builder builder) {
    this.eventCodes = copy(builder.eventCodes);
    this.handler = builder.handler;
    this.handlers = copy(builder.handlers);
    this.namespace = builder.namespace;
    this.namespaces = copy(builder.namespaces);
    this.persistent = builder.persistent;
    this.persistents = copy(builder.persistents);
    this.priority = builder.priority;
    this.priorities = copy(builder.priorities);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> eventCodes() {
    return eventCodes;
  }

  EventHandler handler() {
    return handler;
  }

  List<EventHandler> handlers() {
    return handlers;
  }

  String namespace() {
    return namespace;
  }

  List<String> namespaces() {
    return namespaces;
  }

  Boolean persistent() {
    return persistent;
  }

  List<Boolean> persistents() {
    return persistents;
  }

  Integer priority() {
    return priority;
  }

  List<Integer> priorities() {
    return priorities;
  }

  public int size() {
    return eventCodes == null ? 0 : eventCodes.size();
  }

  // Keeps null elements so they can be reported by index.
  private static <T> List<T> copy(List<T> list) {
    return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
  }

  /** Builder for {@link BulkSubscription}. */
  public static final class Builder {
    private List<String> eventCodes;
    private EventHandler handler;
    private List<EventHandler> handlers;
    private String namespace;
    private List<String> namespaces;
    private Boolean persistent;
    private List<Boolean> persistents;
    private Integer priority;
    private List<Integer> priorities;

    private Builder() {}

    /**
     * <b>Required</b> (or {@link #events(List)}). Event codes to subscribe to; a code of
     * {@code "*"} subscribes namespace-wide.
     */
    public Builder eventCodes(List<String> eventCodes) {
      this.eventCodes = eventCodes;
      return this;
    }

    /**
     * Same as {@link #eventCodes(List)}, taking each event's code.
     */
    public Builder events(List<Event> events) {
      List<String> codes = new ArrayList<>(events.size());
      for (Event event : events) {
        codes.add(event == null ? null : event.code());
      }
      this.eventCodes = codes;
      return this;
    }

    /**
     * One handler for every event. Mutually exclusive with {@link #handlers(List)}.
     */
    public Builder handler(EventHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * One handler per event.
     */
    public Builder handlers(List<EventHandler> handlers) {
      this.handlers = handlers;
      return this;
    }

    /**
     * Optional. Defaults to the dispatcher's default namespace.
     */
    public Builder namespace(String namespace) {
      this.namespace = namespace;
      return this;
    }

    public Builder namespaces(List<String> namespaces) {
      this.namespaces = namespaces;
      return this;
    }

    /**
     * Optional. Defaults to {@code false}.
     */
    public Builder persistent(boolean persistent) {
      this.persistent = persistent;
      return this;
    }

    public Builder persistents(List<Boolean> persistents) {
      this.persistents = persistents;
      return this;
    }

    /**
     * Optional. Defaults to {@code 0}.
     */
    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder priorities(List<Integer> priorities) {
      this.priorities = priorities;
      return this;
    }

    public BulkSubscription build() {
      return new BulkSubscription(this);
    }
  }
}

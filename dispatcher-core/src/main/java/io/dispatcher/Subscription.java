package io.dispatcher;

import java.util.Objects;

/**
 * A handler bound to a namespace and, within it, to an event code.
 *
 * <p>Subscriptions are immutable; changing priority or namespace means removing and
 * re-adding. Identity is the {@link #code()} alone, so two subscriptions of the same
 * handler in the same namespace are distinct and independently removable.
 *
 * <p>An event code of {@link #ANY_EVENT} makes the subscription namespace-wide: it
 * matches every event dispatched to its namespace.
 *
 * <p>Equal priorities run in registration order, which the registry tracks.
 */
public final class Subscription {
  public static final String ANY_EVENT = "*";

  private final String code;
  private final String eventCode;
  private final EventHandler handler;
  private final String namespace;
  private final boolean persistent;
  private final int priority;

  private Subscription(Builder builder) {
    this.code = requireText(builder.code, "code");
    this.eventCode = requireText(builder.eventCode, "eventCode");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.namespace = requireText(builder.namespace, "namespace");
    this.persistent = builder.persistent;
    this.priority = builder.priority;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String code() {
    return code;
  }

  /**
   * Returns the event code this subscription matches, or {@link #ANY_EVENT}.
   */
  public String eventCode() {
    return eventCode;
  }

  public EventHandler handler() {
    return handler;
  }

  public String namespace() {
    return namespace;
  }

  /**
   * Advisory flag for external reloaders. The dispatcher stores it but never acts on it.
   */
  public boolean persistent() {
    return persistent;
  }

  /**
   * Higher priorities run first.
   */
  public int priority() {
    return priority;
  }

  public boolean isNamespaceWide() {
    return ANY_EVENT.equals(eventCode);
  }

  /**
   * Returns whether an event with {@code eventCode} dispatched to {@code namespace}
   * reaches this subscription.
   */
  public boolean matches(String namespace, String eventCode) {
    return this.namespace.equals(namespace)
        && (isNamespaceWide() || this.eventCode.equals(eventCode));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Subscription other)) return false;
    return code.equals(other.code);
  }

  @Override
  public int hashCode() {
    return code.hashCode();
  }

  @Override
  public String toString() {
    return "Subscription{code='" + code + "', namespace='" + namespace
        + "', eventCode='" + eventCode + "', handler=" + handler.name()
        + ", priority=" + priority + ", persistent=" + persistent + "}";
  }

  private static String requireText(String value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " cannot be blank");
    }
    return value;
  }

  /** Builder for {@link Subscription}. */
  public static final class Builder {
    private String code;
    private String eventCode = ANY_EVENT;
    private EventHandler handler;
    private String namespace = Namespaces.GLOBAL;
    private boolean persistent;
    private int priority;

    private Builder() {}

    /**
     * <b>Required.</b> Unique code used as the removal handle.
     */
    public Builder code(String code) {
      this.code = code;
      return this;
    }

    /**
     * Optional. Defaults to {@link #ANY_EVENT}.
     */
    public Builder eventCode(String eventCode) {
      this.eventCode = eventCode;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder handler(EventHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Optional. Defaults to {@link Namespaces#GLOBAL}.
     */
    public Builder namespace(String namespace) {
      this.namespace = namespace;
      return this;
    }

    public Builder persistent(boolean persistent) {
      this.persistent = persistent;
      return this;
    }

    /**
     * Optional. Defaults to {@code 0}.
     */
    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Subscription build() {
      return new Subscription(this);
    }
  }
}

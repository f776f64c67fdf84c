package io.dispatcher;

import io.dispatcher.spi.IdGenerator;
import io.dispatcher.util.UlidIdGenerator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A named occurrence handed to subscribers by the dispatcher.
 *
 * <p>Identity fields ({@code id}, {@code uuid}, {@code name}, {@code code}) are fixed at
 * construction. The {@link #data() payload} is the only mutable part and is safe for
 * concurrent key-level access. Subscriptions match on {@link #code()}, which defaults
 * to the name when not given.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Event event = Event.builder("greeting_event")
 *     .put("name", "Alice")
 *     .build();
 *
 * String name = (String) event.get("name");
 * }</pre>
 *
 * <p>Two events are equal when their {@code code}, {@code id} and {@code name} match.
 */
public final class Event {

    private final long id;
    private final String uuid;
    private final String name;
    private final String code;
    private final Map<String, Object> data;

    private Event(Builder builder) {
        this.name = requireText(builder.name, "name");
        this.code = builder.code == null ? this.name : requireText(builder.code, "code");
        IdGenerator ids = builder.idGenerator != null ? builder.idGenerator : UlidIdGenerator.getDefault();
        this.id = builder.id != null ? builder.id : ids.nextId();
        this.uuid = builder.uuid != null ? requireText(builder.uuid, "uuid") : ids.nextCode();
        this.data = Collections.synchronizedMap(new LinkedHashMap<>(builder.data));
    }

    /**
     * Creates a builder for an event with the given name.
     *
     * @param name the human-readable event name
     * @return a new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static Event of(String name) {
        return builder(name).build();
    }

    public static Event of(String name, Map<String, ?> data) {
        return builder(name).data(data).build();
    }

    public long id() {
        return id;
    }

    public String uuid() {
        return uuid;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the key subscriptions are matched against.
     */
    public String code() {
        return code;
    }

    /**
     * Returns the live payload map. Changes are visible to every holder of this event.
     */
    public Map<String, Object> data() {
        return data;
    }

    /**
     * Returns the payload value stored under {@code key}.
     *
     * @throws NoSuchElementException if the key is absent
     */
    public Object get(String key) {
        synchronized (data) {
            if (!data.containsKey(key)) {
                throw new NoSuchElementException("Event '" + code + "' has no data key: " + key);
            }
            return data.get(key);
        }
    }

    public boolean contains(String key) {
        return data.containsKey(key);
    }

    /**
     * Stores a payload value and returns the previous one, if any.
     */
    public Object put(String key, Object value) {
        return data.put(Objects.requireNonNull(key, "key"), value);
    }

    public Object remove(String key) {
        return data.remove(key);
    }

    public void clear() {
        data.clear();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event other)) return false;
        return id == other.id && code.equals(other.code) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, id, name);
    }

    @Override
    public String toString() {
        return "Event{id=" + id + ", code='" + code + "', name='" + name + "', uuid='" + uuid + "'}";
    }

    private static String requireText(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
        return value;
    }

    /** Builder for {@link Event}. */
    public static final class Builder {
        private final String name;
        private String code;
        private Long id;
        private String uuid;
        private IdGenerator idGenerator;
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Sets the matchable event code.
         *
         * <p>Optional. Defaults to the event name.
         */
        public Builder code(String code) {
            this.code = code;
            return this;
        }

        /**
         * Sets an explicit numeric id.
         *
         * <p>Optional. Defaults to the next id from the configured {@link IdGenerator}.
         */
        public Builder id(long id) {
            this.id = id;
            return this;
        }

        /**
         * Sets an explicit unique string id.
         *
         * <p>Optional. Defaults to a new ULID.
         */
        public Builder uuid(String uuid) {
            this.uuid = uuid;
            return this;
        }

        /**
         * Sets the generator used for ids not given explicitly.
         *
         * <p>Optional. Defaults to {@link UlidIdGenerator#getDefault()}.
         */
        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        /**
         * Copies all entries of {@code data} into the payload.
         */
        public Builder data(Map<String, ?> data) {
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        public Builder put(String key, Object value) {
            this.data.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }
}

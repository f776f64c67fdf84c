package io.dispatcher;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Extra arguments forwarded unchanged to every handler of one dispatch.
 *
 * <p>Holds an ordered list of positional values and a map of keyword values. Instances
 * are immutable; {@link #withKeyword(String, Object)} returns a copy.
 */
public final class DispatchArguments {

    private static final DispatchArguments NONE = new DispatchArguments(List.of(), Map.of());

    private final List<Object> positional;
    private final Map<String, Object> keywords;

    private DispatchArguments(List<Object> positional, Map<String, Object> keywords) {
        this.positional = positional;
        this.keywords = keywords;
    }

    public static DispatchArguments none() {
        return NONE;
    }

    public static DispatchArguments of(Object... positional) {
        return new DispatchArguments(
            Collections.unmodifiableList(Arrays.asList(positional.clone())), Map.of());
    }

    public static DispatchArguments ofKeywords(Map<String, ?> keywords) {
        return NONE.withKeywords(keywords);
    }

    public DispatchArguments withKeyword(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(keywords);
        copy.put(Objects.requireNonNull(key, "key"), value);
        return new DispatchArguments(positional, Collections.unmodifiableMap(copy));
    }

    public DispatchArguments withKeywords(Map<String, ?> more) {
        Map<String, Object> copy = new LinkedHashMap<>(keywords);
        more.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), v));
        return new DispatchArguments(positional, Collections.unmodifiableMap(copy));
    }

    public List<Object> positional() {
        return positional;
    }

    /**
     * @throws IndexOutOfBoundsException if there is no positional argument at {@code index}
     */
    public Object positional(int index) {
        return positional.get(index);
    }

    public Map<String, Object> keywords() {
        return keywords;
    }

    /**
     * @throws NoSuchElementException if no keyword argument named {@code key} was passed
     */
    public Object keyword(String key) {
        if (!keywords.containsKey(key)) {
            throw new NoSuchElementException("No keyword argument: " + key);
        }
        return keywords.get(key);
    }

    public boolean hasKeyword(String key) {
        return keywords.containsKey(key);
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keywords.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DispatchArguments other)) return false;
        return positional.equals(other.positional) && keywords.equals(other.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, keywords);
    }

    @Override
    public String toString() {
        return "DispatchArguments{positional=" + positional + ", keywords=" + keywords + "}";
    }
}

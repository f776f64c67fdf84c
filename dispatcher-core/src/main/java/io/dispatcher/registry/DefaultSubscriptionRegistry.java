package io.dispatcher.registry;

import io.dispatcher.DuplicateSubscriptionCodeException;
import io.dispatcher.EventHandler;
import io.dispatcher.Subscription;
import io.dispatcher.SubscriptionNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Thread-safe registry with three indices kept in step under one lock:
 * <ul>
 *   <li>code to subscription, for removal and lookup by code</li>
 *   <li>namespace to its subscriptions, in registration order</li>
 *   <li>(namespace, event code) to its subscriptions, in registration order, so
 *       {@link #find} never scans a whole namespace</li>
 * </ul>
 *
 * <p>Namespace-wide subscriptions are indexed under the event code
 * {@link Subscription#ANY_EVENT}.
 *
 * <h2>Thread Safety</h2>
 * <p>Mutations take the write lock; queries copy their result under the read lock and
 * return it after releasing the lock. Callers never hold the lock while working with
 * a result.
 *
 * @see SubscriptionRegistry
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private final Map<String, Entry> byCode = new HashMap<>();
  private final Map<String, LinkedHashMap<String, Entry>> byNamespace = new LinkedHashMap<>();
  private final Map<Key, LinkedHashMap<String, Entry>> byEvent = new HashMap<>();
  private long insertions;

  @Override
  public void add(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    Lock w = lock.writeLock();
    w.lock();
    try {
      if (byCode.containsKey(subscription.code())) {
        throw new DuplicateSubscriptionCodeException(subscription.code());
      }
      Entry entry = new Entry(subscription, insertions++);
      byCode.put(subscription.code(), entry);
      byNamespace.computeIfAbsent(subscription.namespace(), ignored -> new LinkedHashMap<>())
          .put(subscription.code(), entry);
      byEvent.computeIfAbsent(Key.of(subscription), ignored -> new LinkedHashMap<>())
          .put(subscription.code(), entry);
    } finally {
      w.unlock();
    }
  }

  @Override
  public Subscription removeByCode(String code) {
    Lock w = lock.writeLock();
    w.lock();
    try {
      Entry entry = byCode.get(code);
      if (entry == null) {
        throw SubscriptionNotFoundException.forCode(code);
      }
      unindex(entry.subscription());
      return entry.subscription();
    } finally {
      w.unlock();
    }
  }

  @Override
  public Optional<Subscription> remove(String namespace, String eventCode, EventHandler handler) {
    Lock w = lock.writeLock();
    w.lock();
    try {
      LinkedHashMap<String, Entry> bucket = byEvent.get(new Key(namespace, eventCode));
      if (bucket == null) {
        return Optional.empty();
      }
      for (Entry entry : bucket.values()) {
        if (entry.subscription().handler().equals(handler)) {
          unindex(entry.subscription());
          return Optional.of(entry.subscription());
        }
      }
      return Optional.empty();
    } finally {
      w.unlock();
    }
  }

  @Override
  public List<Subscription> removeByHandler(EventHandler handler) {
    Objects.requireNonNull(handler, "handler");
    return removeMatching(byCode.values(), s -> s.handler().equals(handler));
  }

  @Override
  public List<Subscription> removeByHandler(EventHandler handler, String namespace) {
    Objects.requireNonNull(handler, "handler");
    Lock w = lock.writeLock();
    w.lock();
    try {
      LinkedHashMap<String, Entry> scoped = byNamespace.get(namespace);
      if (scoped == null) {
        return List.of();
      }
      return removeMatching(scoped.values(), s -> s.handler().equals(handler));
    } finally {
      w.unlock();
    }
  }

  @Override
  public List<Subscription> removeByNamespace(String namespace) {
    Lock w = lock.writeLock();
    w.lock();
    try {
      LinkedHashMap<String, Entry> scoped = byNamespace.get(namespace);
      if (scoped == null) {
        return List.of();
      }
      return removeMatching(scoped.values(), s -> true);
    } finally {
      w.unlock();
    }
  }

  @Override
  public List<Subscription> removeByEvent(String eventCode) {
    return removeMatching(byCode.values(), s -> s.eventCode().equals(eventCode));
  }

  @Override
  public int removeAll() {
    Lock w = lock.writeLock();
    w.lock();
    try {
      int removed = byCode.size();
      byCode.clear();
      byNamespace.clear();
      byEvent.clear();
      return removed;
    } finally {
      w.unlock();
    }
  }

  @Override
  public List<Subscription> find(String namespace, String eventCode) {
    Lock r = lock.readLock();
    r.lock();
    try {
      LinkedHashMap<String, Entry> exact = byEvent.get(new Key(namespace, eventCode));
      LinkedHashMap<String, Entry> wide = Subscription.ANY_EVENT.equals(eventCode)
          ? null : byEvent.get(new Key(namespace, Subscription.ANY_EVENT));
      return merge(exact == null ? List.of() : exact.values(),
          wide == null ? List.of() : wide.values());
    } finally {
      r.unlock();
    }
  }

  @Override
  public Optional<Subscription> findByCode(String code) {
    Lock r = lock.readLock();
    r.lock();
    try {
      Entry entry = byCode.get(code);
      return entry == null ? Optional.empty() : Optional.of(entry.subscription());
    } finally {
      r.unlock();
    }
  }

  @Override
  public List<Subscription> findByHandler(EventHandler handler) {
    return select(s -> s.handler().equals(handler));
  }

  @Override
  public List<Subscription> findByNamespace(String namespace) {
    Lock r = lock.readLock();
    r.lock();
    try {
      LinkedHashMap<String, Entry> scoped = byNamespace.get(namespace);
      return scoped == null ? List.of() : unwrap(scoped.values());
    } finally {
      r.unlock();
    }
  }

  @Override
  public List<Subscription> findByEvent(String eventCode) {
    return select(s -> s.eventCode().equals(eventCode));
  }

  @Override
  public List<Subscription> findAll() {
    return select(s -> true);
  }

  @Override
  public boolean contains(String code) {
    Lock r = lock.readLock();
    r.lock();
    try {
      return byCode.containsKey(code);
    } finally {
      r.unlock();
    }
  }

  @Override
  public int size() {
    Lock r = lock.readLock();
    r.lock();
    try {
      return byCode.size();
    } finally {
      r.unlock();
    }
  }

  @Override
  public List<String> namespaces() {
    Lock r = lock.readLock();
    r.lock();
    try {
      return List.copyOf(byNamespace.keySet());
    } finally {
      r.unlock();
    }
  }

  // Namespace order first, then registration order within each namespace.
  private List<Subscription> select(Predicate<Subscription> filter) {
    Lock r = lock.readLock();
    r.lock();
    try {
      List<Entry> matched = new ArrayList<>();
      for (LinkedHashMap<String, Entry> scoped : byNamespace.values()) {
        for (Entry entry : scoped.values()) {
          if (filter.test(entry.subscription())) {
            matched.add(entry);
          }
        }
      }
      matched.sort((a, b) -> Long.compare(a.ordinal(), b.ordinal()));
      return unwrap(matched);
    } finally {
      r.unlock();
    }
  }

  private List<Subscription> removeMatching(Collection<Entry> candidates, Predicate<Subscription> filter) {
    Lock w = lock.writeLock();
    w.lock();
    try {
      List<Entry> matched = new ArrayList<>();
      for (Entry entry : candidates) {
        if (filter.test(entry.subscription())) {
          matched.add(entry);
        }
      }
      matched.sort((a, b) -> Long.compare(a.ordinal(), b.ordinal()));
      for (Entry entry : matched) {
        unindex(entry.subscription());
      }
      return unwrap(matched);
    } finally {
      w.unlock();
    }
  }

  // Caller holds the write lock.
  private void unindex(Subscription subscription) {
    byCode.remove(subscription.code());
    removeFromBucket(byNamespace, subscription.namespace(), subscription.code());
    removeFromBucket(byEvent, Key.of(subscription), subscription.code());
  }

  private static <K> void removeFromBucket(Map<K, LinkedHashMap<String, Entry>> index, K key, String code) {
    LinkedHashMap<String, Entry> bucket = index.get(key);
    if (bucket != null) {
      bucket.remove(code);
      if (bucket.isEmpty()) {
        index.remove(key);
      }
    }
  }

  private static List<Subscription> merge(Collection<Entry> first, Collection<Entry> second) {
    List<Subscription> result = new ArrayList<>(first.size() + second.size());
    Iterator<Entry> a = first.iterator();
    Iterator<Entry> b = second.iterator();
    Entry nextA = a.hasNext() ? a.next() : null;
    Entry nextB = b.hasNext() ? b.next() : null;
    while (nextA != null || nextB != null) {
      if (nextB == null || (nextA != null && nextA.ordinal() < nextB.ordinal())) {
        result.add(nextA.subscription());
        nextA = a.hasNext() ? a.next() : null;
      } else {
        result.add(nextB.subscription());
        nextB = b.hasNext() ? b.next() : null;
      }
    }
    return Collections.unmodifiableList(result);
  }

  private static List<Subscription> unwrap(Collection<Entry> entries) {
    List<Subscription> result = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      result.add(entry.subscription());
    }
    return Collections.unmodifiableList(result);
  }

  private record Entry(Subscription subscription, long ordinal) {}

  private record Key(String namespace, String eventCode) {
    static Key of(Subscription subscription) {
      return new Key(subscription.namespace(), subscription.eventCode());
    }
  }
}

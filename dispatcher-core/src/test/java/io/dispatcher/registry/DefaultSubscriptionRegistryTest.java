package io.dispatcher.registry;

import io.dispatcher.DuplicateSubscriptionCodeException;
import io.dispatcher.EventHandler;
import io.dispatcher.Subscription;
import io.dispatcher.SubscriptionNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultSubscriptionRegistryTest {

  private final DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();

  private static final EventHandler H1 = EventHandler.named("h1", (event, args) -> 1);
  private static final EventHandler H2 = EventHandler.named("h2", (event, args) -> 2);

  private static Subscription sub(String code, String namespace, String eventCode, EventHandler handler) {
    return Subscription.builder()
        .code(code)
        .namespace(namespace)
        .eventCode(eventCode)
        .handler(handler)
        .build();
  }

  private static List<String> codes(List<Subscription> subscriptions) {
    return subscriptions.stream().map(Subscription::code).collect(Collectors.toList());
  }

  @Test
  void emptyRegistryFindsNothing() {
    assertTrue(registry.find("ns", "e").isEmpty());
    assertEquals(0, registry.size());
    assertTrue(registry.findByCode("missing").isEmpty());
  }

  @Test
  void addedSubscriptionIsVisibleInEveryIndex() {
    registry.add(sub("c1", "ns", "e", H1));

    assertEquals(List.of("c1"), codes(registry.find("ns", "e")));
    assertEquals("c1", registry.findByCode("c1").orElseThrow().code());
    assertEquals(List.of("c1"), codes(registry.findByHandler(H1)));
    assertEquals(List.of("c1"), codes(registry.findByNamespace("ns")));
    assertEquals(List.of("c1"), codes(registry.findByEvent("e")));
    assertTrue(registry.contains("c1"));
    assertEquals(List.of("ns"), registry.namespaces());
  }

  @Test
  void duplicateCodeIsRejected() {
    registry.add(sub("c1", "ns", "e", H1));

    DuplicateSubscriptionCodeException e = assertThrows(DuplicateSubscriptionCodeException.class,
        () -> registry.add(sub("c1", "other", "x", H2)));
    assertEquals("c1", e.code());
    assertEquals(1, registry.size());
    assertTrue(registry.findByNamespace("other").isEmpty());
  }

  // ── find ─────────────────────────────────────────────────────

  @Test
  void findMergesExactAndNamespaceWideInRegistrationOrder() {
    registry.add(sub("wide1", "ns", Subscription.ANY_EVENT, H1));
    registry.add(sub("exact1", "ns", "e", H2));
    registry.add(sub("other", "ns", "x", H2));
    registry.add(sub("wide2", "ns", Subscription.ANY_EVENT, H2));
    registry.add(sub("exact2", "ns", "e", H1));
    registry.add(sub("elsewhere", "other-ns", "e", H1));

    assertEquals(List.of("wide1", "exact1", "wide2", "exact2"), codes(registry.find("ns", "e")));
    assertEquals(List.of("wide1", "other", "wide2"), codes(registry.find("ns", "x")));
  }

  @Test
  void findResultIsAnUnmodifiableSnapshot() {
    registry.add(sub("c1", "ns", "e", H1));
    List<Subscription> snapshot = registry.find("ns", "e");

    registry.add(sub("c2", "ns", "e", H2));

    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
  }

  // ── Removal ──────────────────────────────────────────────────

  @Test
  void removeByCodeRemovesFromAllIndices() {
    registry.add(sub("c1", "ns", "e", H1));

    Subscription removed = registry.removeByCode("c1");

    assertEquals("c1", removed.code());
    assertTrue(registry.find("ns", "e").isEmpty());
    assertTrue(registry.findByHandler(H1).isEmpty());
    assertTrue(registry.findByNamespace("ns").isEmpty());
    assertTrue(registry.namespaces().isEmpty());
    assertEquals(0, registry.size());
  }

  @Test
  void removeByUnknownCodeThrowsAndLeavesStateUnchanged() {
    registry.add(sub("c1", "ns", "e", H1));

    assertThrows(SubscriptionNotFoundException.class, () -> registry.removeByCode("nope"));
    assertEquals(1, registry.size());
  }

  @Test
  void removeTripleTakesEarliestMatchOnly() {
    registry.add(sub("c1", "ns", "e", H1));
    registry.add(sub("c2", "ns", "e", H1));

    assertEquals("c1", registry.remove("ns", "e", H1).orElseThrow().code());
    assertEquals(List.of("c2"), codes(registry.find("ns", "e")));
    assertTrue(registry.remove("ns", "e", H2).isEmpty());
    assertTrue(registry.remove("other", "e", H1).isEmpty());
  }

  @Test
  void removeByHandlerIsNoOpWhenNothingMatches() {
    registry.add(sub("c1", "ns", "e", H1));

    assertTrue(registry.removeByHandler(H2).isEmpty());
    assertEquals(1, registry.size());
  }

  @Test
  void removeByHandlerAcrossNamespaces() {
    registry.add(sub("c1", "a", "e", H1));
    registry.add(sub("c2", "b", "e", H1));
    registry.add(sub("c3", "b", "e", H2));

    assertEquals(List.of("c1", "c2"), codes(registry.removeByHandler(H1)));
    assertEquals(List.of("c3"), codes(registry.findAll()));
  }

  @Test
  void removeByHandlerScopedToNamespace() {
    registry.add(sub("c1", "a", "e", H1));
    registry.add(sub("c2", "b", "e", H1));

    assertEquals(List.of("c2"), codes(registry.removeByHandler(H1, "b")));
    assertEquals(List.of("c1"), codes(registry.findByHandler(H1)));
    assertTrue(registry.removeByHandler(H1, "missing").isEmpty());
  }

  @Test
  void removeByNamespace() {
    registry.add(sub("c1", "a", "e", H1));
    registry.add(sub("c2", "a", Subscription.ANY_EVENT, H2));
    registry.add(sub("c3", "b", "e", H1));

    assertEquals(List.of("c1", "c2"), codes(registry.removeByNamespace("a")));
    assertTrue(registry.find("a", "e").isEmpty());
    assertEquals(List.of("b"), registry.namespaces());
  }

  @Test
  void removeByEventKeepsNamespaceWideSubscriptions() {
    registry.add(sub("c1", "a", "e", H1));
    registry.add(sub("c2", "b", "e", H2));
    registry.add(sub("c3", "a", Subscription.ANY_EVENT, H2));

    assertEquals(List.of("c1", "c2"), codes(registry.removeByEvent("e")));
    assertEquals(List.of("c3"), codes(registry.find("a", "e")));
  }

  @Test
  void removeAllReturnsCount() {
    registry.add(sub("c1", "a", "e", H1));
    registry.add(sub("c2", "b", "e", H2));

    assertEquals(2, registry.removeAll());
    assertEquals(0, registry.size());
    assertTrue(registry.findAll().isEmpty());
  }

  // ── Concurrency ──────────────────────────────────────────────

  @Test
  void concurrentAddsAndRemovesKeepIndicesConsistent() throws Exception {
    int threads = 8;
    int perThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int t = 0; t < threads; t++) {
        int thread = t;
        pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            String code = thread + "-" + i;
            registry.add(sub(code, "ns", "e", H1));
            registry.find("ns", "e");
            if (i % 2 == 0) {
              registry.removeByCode(code);
            }
          }
          return null;
        });
      }
      start.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    int expected = threads * perThread / 2;
    assertEquals(expected, registry.size());
    assertEquals(expected, registry.find("ns", "e").size());
    assertEquals(expected, registry.findByNamespace("ns").size());
    assertEquals(expected, registry.findByHandler(H1).size());
  }
}

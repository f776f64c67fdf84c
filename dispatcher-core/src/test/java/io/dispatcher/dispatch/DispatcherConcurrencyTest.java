package io.dispatcher.dispatch;

import io.dispatcher.Event;
import io.dispatcher.EventHandler;
import io.dispatcher.HandlerError;
import io.dispatcher.Notification;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherConcurrencyTest {

  @Test
  void concurrentEqualPrioritySubscribesRunInListedOrder() throws Exception {
    Dispatcher dispatcher = Dispatcher.create();
    List<String> calls = Collections.synchronizedList(new ArrayList<>());
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < 64; i++) {
        String name = "h" + i;
        EventHandler handler = EventHandler.named(name, (event, args) -> calls.add(name));
        futures.add(pool.submit(() -> {
          start.await();
          return dispatcher.subscribe("e", handler, "ns", false, 5);
        }));
      }
      start.countDown();
      for (Future<String> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    List<String> listed = dispatcher.getSubscriptionsByEvent("e", "ns").stream()
        .map(s -> s.handler().name())
        .toList();
    Notification n = dispatcher.dispatch(Event.of("e"), "ns");

    assertEquals(64, listed.size());
    assertEquals(listed, calls);
    assertEquals(listed, n.functionNames());
  }

  @Test
  void hundredConcurrentSubscribesAllRunExactlyOnce() throws Exception {
    Dispatcher dispatcher = Dispatcher.create();
    int count = 100;
    ConcurrentHashMap<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    ExecutorService pool = Executors.newFixedThreadPool(16);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < count; i++) {
        String name = "h" + i;
        boolean fails = i % 10 == 0;
        EventHandler handler = EventHandler.named(name, (event, args) -> {
          invocations.computeIfAbsent(name, ignored -> new AtomicInteger()).incrementAndGet();
          if (fails) {
            throw new IllegalStateException(name);
          }
          return name;
        });
        Callable<String> task = () -> {
          start.await();
          return dispatcher.subscribe("e", handler, "ns");
        };
        futures.add(pool.submit(task));
      }
      start.countDown();

      Set<String> codes = new HashSet<>();
      for (Future<String> future : futures) {
        codes.add(future.get(30, TimeUnit.SECONDS));
      }
      assertEquals(count, codes.size());
    } finally {
      pool.shutdownNow();
    }

    Notification n = dispatcher.dispatch(Event.of("e"), "ns");

    Set<String> seen = new HashSet<>(n.content().keySet());
    for (HandlerError error : n.errors()) {
      assertTrue(seen.add(error.handlerName()), "duplicate " + error.handlerName());
    }
    assertEquals(count, seen.size());
    assertEquals(count, n.content().size() + n.errors().size());
    assertEquals(count, invocations.size());
    invocations.forEach((name, calls) -> assertEquals(1, calls.get(), name));
  }

  @Test
  void dispatchDuringConcurrentMutationNeverFails() throws Exception {
    Dispatcher dispatcher = Dispatcher.create();
    EventHandler stable = EventHandler.named("stable", (event, args) -> "ok");
    dispatcher.subscribe("e", stable, "ns");
    ExecutorService pool = Executors.newFixedThreadPool(4);
    AtomicInteger dispatches = new AtomicInteger();
    try {
      Future<?> mutator = pool.submit(() -> {
        for (int i = 0; i < 500; i++) {
          String code = dispatcher.subscribe("e", EventHandler.named("churn", (event, args) -> "c"), "ns");
          dispatcher.unsubscribeByCode(code);
        }
      });
      Future<?> reader = pool.submit(() -> {
        for (int i = 0; i < 500; i++) {
          Notification n = dispatcher.dispatch(Event.of("e"), "ns");
          assertFalse(n.hasErrors());
          assertEquals("ok", n.get("stable"));
          dispatches.incrementAndGet();
        }
      });
      mutator.get(30, TimeUnit.SECONDS);
      reader.get(30, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    assertEquals(500, dispatches.get());
    assertEquals(1, dispatcher.subscriptionCount());
  }
}

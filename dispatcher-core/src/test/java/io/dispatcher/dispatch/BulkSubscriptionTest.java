package io.dispatcher.dispatch;

import io.dispatcher.ConfigurationException;
import io.dispatcher.DispatchArguments;
import io.dispatcher.Event;
import io.dispatcher.EventHandler;
import io.dispatcher.InvalidHandlerException;
import io.dispatcher.Namespaces;
import io.dispatcher.Notification;
import io.dispatcher.Subscription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BulkSubscriptionTest {

  private final Dispatcher dispatcher = Dispatcher.create();
  private final List<String> calls = new ArrayList<>();

  private EventHandler recording(String name) {
    return EventHandler.named(name, (event, args) -> {
      calls.add(name);
      return name;
    });
  }

  @Test
  void zipsPerItemListsWithEvents() {
    EventHandler h1 = recording("h1");
    EventHandler h2 = recording("h2");

    List<String> codes = dispatcher.bulkSubscribe(BulkSubscription.builder()
        .eventCodes(List.of("e1", "e2"))
        .handlers(List.of(h1, h2))
        .namespace("ns")
        .priorities(List.of(0, 10))
        .build());

    assertEquals(2, codes.size());
    Subscription first = dispatcher.getSubscriptionByCode(codes.get(0));
    Subscription second = dispatcher.getSubscriptionByCode(codes.get(1));
    assertEquals("e1", first.eventCode());
    assertEquals(0, first.priority());
    assertEquals("e2", second.eventCode());
    assertEquals(10, second.priority());

    Notification n = dispatcher.dispatch(Event.of("e2"), "ns");

    assertEquals(List.of("h2"), calls);
    assertEquals(List.of("h2"), n.functionNames());
  }

  @Test
  void broadcastsScalarValues() {
    EventHandler h = recording("h");

    List<String> codes = dispatcher.bulkSubscribe(BulkSubscription.builder()
        .events(List.of(Event.of("a"), Event.of("b"), Event.of("c")))
        .handler(h)
        .namespace("ns")
        .persistent(true)
        .priority(3)
        .build());

    assertEquals(3, codes.size());
    for (String code : codes) {
      Subscription s = dispatcher.getSubscriptionByCode(code);
      assertSame(h, s.handler());
      assertEquals("ns", s.namespace());
      assertTrue(s.persistent());
      assertEquals(3, s.priority());
    }
  }

  @Test
  void defaultsApplyWhenOptionalValuesAreMissing() {
    List<String> codes = dispatcher.bulkSubscribe(BulkSubscription.builder()
        .eventCodes(List.of("a"))
        .handler(recording("h"))
        .build());

    Subscription s = dispatcher.getSubscriptionByCode(codes.get(0));
    assertEquals(Namespaces.GLOBAL, s.namespace());
    assertFalse(s.persistent());
    assertEquals(0, s.priority());
  }

  @Test
  void perItemNamespacesAndFlags() {
    List<String> codes = dispatcher.bulkSubscribe(BulkSubscription.builder()
        .eventCodes(List.of("a", "b"))
        .handler(recording("h"))
        .namespaces(List.of("x", "y"))
        .persistents(List.of(true, false))
        .build());

    assertEquals("x", dispatcher.getSubscriptionByCode(codes.get(0)).namespace());
    assertTrue(dispatcher.getSubscriptionByCode(codes.get(0)).persistent());
    assertEquals("y", dispatcher.getSubscriptionByCode(codes.get(1)).namespace());
    assertFalse(dispatcher.getSubscriptionByCode(codes.get(1)).persistent());
  }

  // ── Malformed input ──────────────────────────────────────────

  @Test
  void lengthMismatchFailsBeforeAnyMutation() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder()
            .eventCodes(List.of("a", "b", "c"))
            .handler(recording("h"))
            .priorities(List.of(1, 2))
            .build()));

    assertTrue(e.getMessage().contains("priorities"));
    assertEquals(0, dispatcher.subscriptionCount());
  }

  @Test
  void handlerListMismatchFails() {
    assertThrows(ConfigurationException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder()
            .eventCodes(List.of("a", "b"))
            .handlers(List.of(recording("h")))
            .build()));
    assertEquals(0, dispatcher.subscriptionCount());
  }

  @Test
  void missingEventsOrHandlersFails() {
    assertThrows(ConfigurationException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder().handler(recording("h")).build()));
    assertThrows(ConfigurationException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder().eventCodes(List.of("a")).build()));
  }

  @Test
  void scalarAndListTogetherFails() {
    assertThrows(ConfigurationException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder()
            .eventCodes(List.of("a"))
            .handler(recording("h"))
            .namespace("ns")
            .namespaces(List.of("ns"))
            .build()));
    assertEquals(0, dispatcher.subscriptionCount());
  }

  // ── Per-item validation ──────────────────────────────────────

  @Test
  void nullHandlerNamesItsIndexAndKeepsEarlierItems() {
    InvalidHandlerException e = assertThrows(InvalidHandlerException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder()
            .eventCodes(List.of("a", "b", "c"))
            .handlers(Arrays.asList(recording("h1"), null, recording("h3")))
            .build()));

    assertTrue(e.getMessage().contains("index 1"));
    assertEquals(1, dispatcher.subscriptionCount());
    assertEquals("a", dispatcher.getSubscriptions().get(0).eventCode());
  }

  @Test
  void namelessHandlerNamesItsIndexAndKeepsEarlierItems() {
    EventHandler nameless = new EventHandler() {
      @Override
      public String name() {
        return null;
      }

      @Override
      public Object handle(Event event, DispatchArguments arguments) {
        return null;
      }
    };

    InvalidHandlerException e = assertThrows(InvalidHandlerException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder()
            .eventCodes(List.of("a", "b"))
            .handlers(List.of(recording("h1"), nameless))
            .build()));

    assertTrue(e.getMessage().contains("index 1"));
    assertEquals(1, dispatcher.subscriptionCount());
  }

  @Test
  void blankEventCodeNamesItsIndex() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder()
            .eventCodes(Arrays.asList("a", "b", " "))
            .handler(recording("h"))
            .build()));

    assertTrue(e.getMessage().contains("index 2"));
    assertEquals(2, dispatcher.subscriptionCount());
  }

  @Test
  void nullPriorityNamesItsIndex() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> dispatcher.bulkSubscribe(BulkSubscription.builder()
            .eventCodes(List.of("a", "b"))
            .handler(recording("h"))
            .priorities(Arrays.asList(null, 1))
            .build()));

    assertTrue(e.getMessage().contains("index 0"));
    assertEquals(0, dispatcher.subscriptionCount());
  }

  @Test
  void emptyBulkSubscribesNothing() {
    List<String> codes = dispatcher.bulkSubscribe(BulkSubscription.builder()
        .eventCodes(List.of())
        .handlers(List.of())
        .build());

    assertTrue(codes.isEmpty());
  }
}

package io.dispatcher.demo;

import io.dispatcher.DispatchArguments;
import io.dispatcher.Event;
import io.dispatcher.EventHandler;
import io.dispatcher.HandlerError;
import io.dispatcher.Namespaces;
import io.dispatcher.Notification;
import io.dispatcher.dispatch.BulkSubscription;
import io.dispatcher.dispatch.Dispatcher;
import io.dispatcher.dispatch.EventInterceptor;

import java.util.List;

/**
 * Simple demo showing dispatcher usage without Spring.
 *
 * Run with: mvn -pl samples/dispatcher-demo exec:java
 */
public final class DispatcherDemo {

  public static void main(String[] args) {
    // 1. Create dispatcher with an audit interceptor
    Dispatcher dispatcher = Dispatcher.builder()
        .interceptor(EventInterceptor.before((event, namespace) ->
            System.out.println("[Audit] Dispatching " + event.code() + " to " + namespace)))
        .build();

    // 2. Namespace-wide greeter
    EventHandler greeter = EventHandler.named("h1",
        (event, arguments) -> "Hello, " + event.get("name") + "!");
    dispatcher.subscribeAll(greeter, "greet");

    Notification greeting = dispatcher.dispatch(
        Event.builder("greeting_event").put("name", "Alice").build(), "greet");
    System.out.println("[Result] " + greeting.status() + " " + greeting.content());

    // 3. Priorities, arguments and a failing handler
    EventHandler reserve = EventHandler.named("reserve_stock",
        (event, arguments) -> "reserved " + event.get("sku") + " for " + arguments.keyword("user"));
    EventHandler charge = EventHandler.named("charge_card", (event, arguments) -> {
      throw new IllegalStateException("card declined");
    });
    EventHandler email = EventHandler.named("send_email",
        (event, arguments) -> "mailed " + arguments.keyword("user"));

    List<String> codes = dispatcher.bulkSubscribe(BulkSubscription.builder()
        .eventCodes(List.of("order_placed", "order_placed", "order_placed"))
        .handlers(List.of(reserve, charge, email))
        .namespace(Namespaces.LOCAL)
        .priorities(List.of(100, 50, 0))
        .build());

    Notification order = dispatcher.dispatch(
        Event.builder("order_placed").put("sku", "SKU-42").build(),
        Namespaces.LOCAL,
        DispatchArguments.none().withKeyword("user", "alice"));

    System.out.println("[Result] " + order.status() + " in " + order.duration().toMillis() + "ms");
    order.content().forEach((name, value) -> System.out.println("  ok    " + name + " -> " + value));
    for (HandlerError error : order.errors()) {
      System.out.println("  error " + error.handlerName() + " -> " + error.message());
    }

    // 4. Remove the failing handler and retry
    dispatcher.unsubscribeByCode(codes.get(1));
    Notification retry = dispatcher.dispatch(
        Event.builder("order_placed").put("sku", "SKU-42").build(),
        Namespaces.LOCAL,
        DispatchArguments.none().withKeyword("user", "alice"));
    System.out.println("[Retry] " + retry.status() + " " + retry.functionNames());

    System.out.println("Subscriptions left: " + dispatcher.subscriptionCount());
    dispatcher.unsubscribeAll();
  }
}

package io.dispatcher.spring.boot;

import io.dispatcher.DispatchArguments;
import io.dispatcher.Event;
import io.dispatcher.EventHandler;
import io.dispatcher.Notification;
import io.dispatcher.dispatch.Dispatcher;
import io.dispatcher.dispatch.EventInterceptor;
import io.dispatcher.registry.DefaultSubscriptionRegistry;
import io.dispatcher.registry.SubscriptionRegistry;
import io.dispatcher.spi.IdGenerator;
import io.dispatcher.util.UlidIdGenerator;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(DispatcherAutoConfiguration.class));

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("subscriptionRegistry"));
      assertTrue(ctx.containsBean("dispatcherIdGenerator"));
      assertTrue(ctx.containsBean("dispatcher"));
      assertTrue(ctx.containsBean("eventSubscriberRegistrar"));

      assertInstanceOf(DefaultSubscriptionRegistry.class, ctx.getBean(SubscriptionRegistry.class));
      assertInstanceOf(UlidIdGenerator.class, ctx.getBean(IdGenerator.class));
      assertEquals("global", ctx.getBean(Dispatcher.class).defaultNamespace());
    });
  }

  @Test
  void appliesDefaultNamespaceProperty() {
    runner.withPropertyValues("dispatcher.default-namespace=local").run(ctx -> {
      Dispatcher dispatcher = ctx.getBean(Dispatcher.class);
      assertEquals("local", dispatcher.defaultNamespace());
    });
  }

  @Test
  void subscribesAnnotatedHandlers() {
    runner.withUserConfiguration(GreeterConfig.class).run(ctx -> {
      Dispatcher dispatcher = ctx.getBean(Dispatcher.class);

      Notification n = dispatcher.dispatch(
          Event.builder("greeting_event").put("name", "Alice").build(), "greet");

      assertEquals("Hello, Alice!", n.get("h1"));
    });
  }

  @Test
  void appliesInterceptorsAndClockBeans() {
    runner.withUserConfiguration(InterceptorConfig.class).run(ctx -> {
      Dispatcher dispatcher = ctx.getBean(Dispatcher.class);
      dispatcher.subscribe("e", EventHandler.named("h", (event, args) -> "ok"));

      Notification n = dispatcher.dispatch(Event.of("e"));

      assertEquals(List.of("e"), ctx.getBean(InterceptorConfig.class).seen);
      assertEquals(InterceptorConfig.FIXED, n.start());
    });
  }

  @Test
  void backsOffWhenDispatcherDefined() {
    runner.withUserConfiguration(CustomDispatcherConfig.class).run(ctx -> {
      assertSame(CustomDispatcherConfig.DISPATCHER, ctx.getBean(Dispatcher.class));
    });
  }

  @EventSubscriber(namespace = "greet", name = "h1")
  static class Greeter implements EventHandler {
    @Override
    public Object handle(Event event, DispatchArguments arguments) {
      return "Hello, " + event.get("name") + "!";
    }
  }

  @Configuration
  static class GreeterConfig {
    @Bean
    Greeter greeter() {
      return new Greeter();
    }
  }

  @Configuration
  static class InterceptorConfig {
    static final Instant FIXED = Instant.parse("2024-01-01T00:00:00Z");
    final List<String> seen = new ArrayList<>();

    @Bean
    EventInterceptor recordingInterceptor() {
      return EventInterceptor.before((event, namespace) -> seen.add(event.code()));
    }

    @Bean
    Clock fixedClock() {
      return Clock.fixed(FIXED, ZoneOffset.UTC);
    }
  }

  @Configuration
  static class CustomDispatcherConfig {
    static final Dispatcher DISPATCHER = Dispatcher.create();

    @Bean
    Dispatcher dispatcher() {
      return DISPATCHER;
    }
  }
}

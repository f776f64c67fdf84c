package io.dispatcher.spring.boot;

import io.dispatcher.dispatch.Dispatcher;
import io.dispatcher.dispatch.EventInterceptor;
import io.dispatcher.registry.DefaultSubscriptionRegistry;
import io.dispatcher.registry.SubscriptionRegistry;
import io.dispatcher.spi.IdGenerator;
import io.dispatcher.spi.MetricsExporter;
import io.dispatcher.util.UlidIdGenerator;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for the dispatcher.
 *
 * <p>Wires a {@link Dispatcher} from {@link DispatcherProperties} and whatever
 * {@link MetricsExporter}, {@link IdGenerator}, {@link Clock} and {@link EventInterceptor}
 * beans the context holds, then subscribes every {@link EventSubscriber} bean.
 *
 * @see DispatcherProperties
 * @see DispatcherMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Dispatcher.class)
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SubscriptionRegistry subscriptionRegistry() {
    return new DefaultSubscriptionRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public IdGenerator dispatcherIdGenerator() {
    return new UlidIdGenerator();
  }

  @Bean
  @ConditionalOnMissingBean
  public Dispatcher dispatcher(DispatcherProperties props,
      SubscriptionRegistry subscriptionRegistry,
      IdGenerator idGenerator,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider,
      ObjectProvider<EventInterceptor> interceptorProvider) {
    var builder = Dispatcher.builder()
        .registry(subscriptionRegistry)
        .idGenerator(idGenerator)
        .defaultNamespace(props.getDefaultNamespace());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Clock clock = clockProvider.getIfAvailable();
    if (clock != null) {
      builder.clock(clock);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriberRegistrar eventSubscriberRegistrar(ListableBeanFactory beanFactory,
      Dispatcher dispatcher) {
    return new EventSubscriberRegistrar(beanFactory, dispatcher);
  }
}

package io.dispatcher.spring.boot;

import io.dispatcher.micrometer.MicrometerMetricsExporter;
import io.dispatcher.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code dispatcher.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link DispatcherAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the dispatcher.
 */
@AutoConfiguration(before = DispatcherAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "dispatcher.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, DispatcherProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}

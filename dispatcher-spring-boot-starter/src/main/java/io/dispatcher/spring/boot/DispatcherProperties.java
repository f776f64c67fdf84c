package io.dispatcher.spring.boot;

import io.dispatcher.Namespaces;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the dispatcher.
 *
 * @see DispatcherAutoConfiguration
 */
@ConfigurationProperties(prefix = "dispatcher")
public class DispatcherProperties {

    /**
     * Namespace used when subscribing or dispatching without one.
     */
    private String defaultNamespace = Namespaces.GLOBAL;

    private final Metrics metrics = new Metrics();

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public void setDefaultNamespace(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        /**
         * Whether to export Micrometer metrics when Micrometer is on the classpath.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "dispatcher";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

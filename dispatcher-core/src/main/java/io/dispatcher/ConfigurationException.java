package io.dispatcher;

/**
 * Thrown when a bulk operation receives malformed input, such as per-item lists
 * whose length does not match the number of events.
 */
public final class ConfigurationException extends DispatcherException {

    public ConfigurationException(String message) {
        super(message);
    }
}

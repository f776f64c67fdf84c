package io.dispatcher;

/**
 * Outcome of one dispatch call.
 */
public enum NotificationStatus {
    /** Every handler returned normally, or no handler matched. */
    SUCCESS,
    /** At least one handler failed. */
    FAILURE
}

package io.dispatcher;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A handler failure captured during dispatch.
 *
 * @param subscriptionCode code of the subscription whose handler failed, or {@code null}
 *                         when the failure came from an interceptor
 * @param handlerName      name of the failing handler or interceptor
 * @param namespace        namespace the event was dispatched to
 * @param message          failure message, never {@code null}
 * @param cause            the thrown exception
 */
public record HandlerError(
    String subscriptionCode,
    String handlerName,
    String namespace,
    String message,
    Throwable cause) {

  public HandlerError {
    Objects.requireNonNull(handlerName, "handlerName");
    Objects.requireNonNull(namespace, "namespace");
    if (message == null) {
      message = cause == null ? "unknown error" : describe(cause);
    }
  }

  public static HandlerError of(Subscription subscription, String handlerName, Throwable cause) {
    return new HandlerError(subscription.code(), handlerName,
        subscription.namespace(), describe(cause), cause);
  }

  /**
   * Renders the cause's stack trace, or an empty string when there is no cause.
   */
  public String stackTrace() {
    if (cause == null) {
      return "";
    }
    StringWriter out = new StringWriter();
    cause.printStackTrace(new PrintWriter(out));
    return out.toString();
  }

  private static String describe(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
  }
}

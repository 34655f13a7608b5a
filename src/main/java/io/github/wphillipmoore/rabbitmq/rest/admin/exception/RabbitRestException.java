package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

/**
 * Base exception for all RabbitMQ management API errors.
 *
 * <p>This is an unchecked exception hierarchy. Asynchronous operations complete their futures
 * exceptionally with one of these subclasses; {@link RabbitRestArgumentException} is the only one
 * thrown directly, before a request is dispatched.
 */
public sealed class RabbitRestException extends RuntimeException
    permits RabbitRestTransportException,
        RabbitRestStatusException,
        RabbitRestResponseException,
        RabbitRestArgumentException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public RabbitRestException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public RabbitRestException(String message, Throwable cause) {
    super(message, cause);
  }
}

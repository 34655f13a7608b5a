package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

/**
 * Thrown when a caller supplies an invalid combination of arguments.
 *
 * <p>Always thrown synchronously, before any request is dispatched, so it can never be confused
 * with a rejection reported by the broker.
 */
public final class RabbitRestArgumentException extends RabbitRestException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an argument exception.
   *
   * @param message description of the invalid arguments
   */
  public RabbitRestArgumentException(String message) {
    super(message);
  }

  /**
   * Creates an argument exception with the check that rejected the arguments.
   *
   * @param message description of the invalid arguments
   * @param cause the underlying validation failure
   */
  public RabbitRestArgumentException(String message, Throwable cause) {
    super(message, cause);
  }
}

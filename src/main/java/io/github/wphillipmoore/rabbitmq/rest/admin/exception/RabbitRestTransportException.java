package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

import java.util.Objects;

/**
 * Thrown when the HTTP exchange with the management API could not be completed: connection
 * refused, DNS failure, timeout, or a connection dropped mid-exchange.
 */
public final class RabbitRestTransportException extends RabbitRestException {

  private static final long serialVersionUID = 1L;

  private final String method;
  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param method the HTTP method of the failed request
   * @param url the URL that was being accessed
   */
  public RabbitRestTransportException(String message, String method, String url) {
    super(message);
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param method the HTTP method of the failed request
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public RabbitRestTransportException(
      String message, String method, String url, Throwable cause) {
    super(message, cause);
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the HTTP method of the failed request. */
  public String getMethod() {
    return method;
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}

package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

import java.util.Objects;

/**
 * Thrown when the management API answers with a non-2xx status.
 *
 * <p>Carries the status code and the raw response body so callers can tell a missing resource
 * (404) from a rejected request (400) or an authentication failure (401/403). The body is kept
 * for every HTTP method, including PUT, POST and DELETE.
 */
public final class RabbitRestStatusException extends RabbitRestException {

  private static final long serialVersionUID = 1L;

  private final String method;
  private final String url;
  private final int statusCode;
  private final String responseBody;

  /**
   * Creates a status exception.
   *
   * @param message description of the failure
   * @param method the HTTP method of the rejected request
   * @param url the URL that was requested
   * @param statusCode the HTTP status code returned by the broker
   * @param responseBody the raw response body, never null (empty if the broker sent none)
   */
  public RabbitRestStatusException(
      String message, String method, String url, int statusCode, String responseBody) {
    super(message);
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
    this.statusCode = statusCode;
    this.responseBody = Objects.requireNonNull(responseBody, "responseBody");
  }

  /** Returns the HTTP method of the rejected request. */
  public String getMethod() {
    return method;
  }

  /** Returns the URL that was requested. */
  public String getUrl() {
    return url;
  }

  /** Returns the HTTP status code. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the raw response body. Empty if the broker sent none. */
  public String getResponseBody() {
    return responseBody;
  }

  /** Returns whether the broker reported the resource as not found (HTTP 404). */
  public boolean isNotFound() {
    return statusCode == 404;
  }

  /** Returns whether the broker rejected the credentials or their permissions (401 or 403). */
  public boolean isAuthFailure() {
    return statusCode == 401 || statusCode == 403;
  }
}

package io.github.wphillipmoore.rabbitmq.rest.admin;

import io.github.wphillipmoore.rabbitmq.rest.admin.auth.Credentials;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Immutable connection settings shared by every call a {@link ResourceClient} makes.
 *
 * <p>The base URL is normalized without trailing slashes. Default header names are compared
 * case-insensitively, and {@code Content-Type} is always {@code application/json}.
 *
 * @param baseUrl the management API root, e.g. {@code http://localhost:15672}
 * @param credentials the credentials attached to every request
 * @param defaultHeaders headers sent with every request, unmodifiable
 * @param verifyTls whether TLS certificates are verified
 * @param timeout per-request timeout, or {@code null} for the transport's default
 */
public record ClientConfig(
    String baseUrl,
    Credentials credentials,
    Map<String, String> defaultHeaders,
    boolean verifyTls,
    @Nullable Duration timeout) {

  static final String CONTENT_TYPE_HEADER = "Content-Type";
  static final String ACCEPT_HEADER = "Accept";
  static final String JSON_MEDIA_TYPE = "application/json";

  /** Validates fields, strips trailing slashes and pins the JSON content type. */
  public ClientConfig {
    baseUrl = stripTrailingSlashes(Objects.requireNonNull(baseUrl, "baseUrl"));
    Objects.requireNonNull(credentials, "credentials");
    Objects.requireNonNull(defaultHeaders, "defaultHeaders");
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }

    Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.put(ACCEPT_HEADER, JSON_MEDIA_TYPE);
    defaultHeaders.forEach(
        (name, value) ->
            headers.put(
                Objects.requireNonNull(name, "header name"),
                Objects.requireNonNull(value, "header value")));
    headers.put(CONTENT_TYPE_HEADER, JSON_MEDIA_TYPE);
    defaultHeaders = Collections.unmodifiableMap(headers);
  }

  static String stripTrailingSlashes(String url) {
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    return url;
  }
}

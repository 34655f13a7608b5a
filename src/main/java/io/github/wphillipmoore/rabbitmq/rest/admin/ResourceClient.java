package io.github.wphillipmoore.rabbitmq.rest.admin;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.BasicAuth;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.Credentials;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.PrebuiltAuth;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestArgumentException;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestResponseException;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestStatusException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;

/**
 * Generic HTTP resource client underneath every management API method.
 *
 * <p>Owns the immutable {@link ClientConfig} and exposes four verb primitives: {@link #fetch}
 * (GET), {@link #upsert} (PUT), {@link #create} (POST) and {@link #remove} (DELETE). Each call
 * merges the default headers with the per-call {@link RequestOptions}, attaches the configured
 * authentication, JSON-encodes the body if one is given, and dispatches one request through the
 * {@link RabbitRestTransport}.
 *
 * <p>Every primitive returns a future that either completes with the result or completes
 * exceptionally with exactly one {@link
 * io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestException}: a {@link
 * RabbitRestStatusException} for non-2xx answers, a transport exception for failed exchanges, or
 * a {@link RabbitRestResponseException} for undecodable 2xx bodies. Invalid arguments, such as
 * a path without a leading {@code /} or a header the transport cannot send, are thrown from the
 * call itself as {@link RabbitRestArgumentException}. No call is retried. Instances hold no
 * mutable state and are safe for concurrent use.
 *
 * <pre>{@code
 * ResourceClient client = new ResourceClient.Builder(
 *         "http://localhost:15672", new BasicAuth("guest", "guest"))
 *     .build();
 * Object overview = client.fetch("/api/overview").join();
 * }</pre>
 */
public final class ResourceClient {

  static final String AUTHORIZATION_HEADER = "Authorization";

  private static final Gson GSON = new Gson();

  private final ClientConfig config;
  private final RabbitRestTransport transport;
  private final String authorization;

  private ResourceClient(ClientConfig config, RabbitRestTransport transport) {
    this.config = Objects.requireNonNull(config, "config");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.authorization = buildAuthorization(config.credentials());
  }

  /** Returns the immutable configuration of this client. */
  public ClientConfig getConfig() {
    return config;
  }

  /**
   * Issues a GET and decodes the JSON response.
   *
   * @param path absolute API path beginning with {@code /}, segments already encoded
   * @param options per-call headers and query parameters
   * @return a future completed with the decoded value: a {@code Map}, {@code List}, {@code
   *     String}, {@code Double}, {@code Boolean}, or {@code null} for an empty body
   */
  public CompletableFuture<@Nullable Object> fetch(String path, RequestOptions options) {
    return dispatch("GET", path, null, options).thenApply(response -> decodeJson(response.body()));
  }

  /** Issues a GET with no per-call options. See {@link #fetch(String, RequestOptions)}. */
  public CompletableFuture<@Nullable Object> fetch(String path) {
    return fetch(path, RequestOptions.none());
  }

  /**
   * Issues a PUT. The response body of a successful call is discarded.
   *
   * @param path absolute API path beginning with {@code /}, segments already encoded
   * @param body JSON-serializable body, or {@code null} to send no payload
   * @param options per-call headers and query parameters
   * @return a future completed when the broker has accepted the request
   */
  public CompletableFuture<Void> upsert(
      String path, @Nullable Object body, RequestOptions options) {
    return dispatch("PUT", path, body, options).thenApply(response -> null);
  }

  /** Issues a PUT with no per-call options. */
  public CompletableFuture<Void> upsert(String path, @Nullable Object body) {
    return upsert(path, body, RequestOptions.none());
  }

  /**
   * Issues a POST. Used for resource creation and for action endpoints such as importing
   * definitions. The response body of a successful call is discarded.
   *
   * @param path absolute API path beginning with {@code /}, segments already encoded
   * @param body JSON-serializable body, or {@code null} to send no payload
   * @param options per-call headers and query parameters
   * @return a future completed when the broker has accepted the request
   */
  public CompletableFuture<Void> create(
      String path, @Nullable Object body, RequestOptions options) {
    return dispatch("POST", path, body, options).thenApply(response -> null);
  }

  /** Issues a POST with no per-call options. */
  public CompletableFuture<Void> create(String path, @Nullable Object body) {
    return create(path, body, RequestOptions.none());
  }

  /**
   * Issues a DELETE. No body is sent.
   *
   * @param path absolute API path beginning with {@code /}, segments already encoded
   * @param options per-call headers and query parameters
   * @return a future completed when the broker has accepted the request
   */
  public CompletableFuture<Void> remove(String path, RequestOptions options) {
    return dispatch("DELETE", path, null, options).thenApply(response -> null);
  }

  /** Issues a DELETE with no per-call options. See {@link #remove(String, RequestOptions)}. */
  public CompletableFuture<Void> remove(String path) {
    return remove(path, RequestOptions.none());
  }

  private CompletableFuture<TransportResponse> dispatch(
      String method, String path, @Nullable Object body, RequestOptions options) {
    Objects.requireNonNull(options, "options");
    String url = buildUrl(config.baseUrl(), path, options.queryParameters());

    CompletableFuture<TransportResponse> exchange;
    try {
      @Nullable String payload = body != null ? GSON.toJson(body) : null;
      Map<String, String> headers =
          mergeHeaders(config.defaultHeaders(), options.headers(), payload != null, authorization);
      exchange =
          transport.send(method, url, payload, headers, config.timeout(), config.verifyTls());
    } catch (RabbitRestArgumentException e) {
      throw e;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return exchange.thenApply(response -> raiseForStatus(method, url, response));
  }

  /**
   * Builds the request URL from the normalized base URL, the path and the query parameters.
   *
   * @throws RabbitRestArgumentException if the path does not begin with {@code /}
   */
  static String buildUrl(String baseUrl, String path, Map<String, String> queryParameters) {
    Objects.requireNonNull(path, "path");
    if (!path.startsWith("/")) {
      throw new RabbitRestArgumentException("path must begin with '/': " + path);
    }
    StringBuilder url = new StringBuilder(baseUrl).append(path);
    if (!queryParameters.isEmpty()) {
      StringJoiner query = new StringJoiner("&", "?", "");
      queryParameters.forEach(
          (name, value) ->
              query.add(
                  URLEncoder.encode(name, StandardCharsets.UTF_8)
                      + '='
                      + URLEncoder.encode(value, StandardCharsets.UTF_8)));
      url.append(query);
    }
    return url.toString();
  }

  /**
   * Overlays call-specific headers on the defaults. Names compare case-insensitively and the
   * call-specific value wins. A JSON body forces the JSON content type, and the configured
   * authorization always replaces any caller-supplied one.
   */
  static Map<String, String> mergeHeaders(
      Map<String, String> defaults,
      Map<String, String> overrides,
      boolean hasJsonBody,
      String authorization) {
    Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    merged.putAll(defaults);
    merged.putAll(overrides);
    if (hasJsonBody) {
      merged.put(ClientConfig.CONTENT_TYPE_HEADER, ClientConfig.JSON_MEDIA_TYPE);
    }
    merged.remove(AUTHORIZATION_HEADER);
    merged.put(AUTHORIZATION_HEADER, authorization);
    return Collections.unmodifiableMap(merged);
  }

  static TransportResponse raiseForStatus(String method, String url, TransportResponse response) {
    if (!response.isSuccessful()) {
      throw new RabbitRestStatusException(
          method + " " + url + " returned HTTP " + response.statusCode(),
          method,
          url,
          response.statusCode(),
          response.body());
    }
    return response;
  }

  static @Nullable Object decodeJson(String text) {
    if (text.isBlank()) {
      return null;
    }
    try {
      return GSON.fromJson(text, Object.class);
    } catch (JsonParseException e) {
      throw new RabbitRestResponseException("Invalid JSON in response", text, e);
    }
  }

  static String buildAuthorization(Credentials credentials) {
    if (credentials instanceof BasicAuth basicAuth) {
      return buildBasicAuthHeader(basicAuth.username(), basicAuth.password());
    }
    if (credentials instanceof PrebuiltAuth prebuiltAuth) {
      return prebuiltAuth.authorization();
    }
    throw new IllegalStateException(
        "Unsupported credentials type: " + credentials.getClass().getName());
  }

  static String buildBasicAuthHeader(String username, String password) {
    String credentials = username + ":" + password;
    String encoded =
        Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    return "Basic " + encoded;
  }

  /** Builder for {@link ResourceClient}. */
  public static final class Builder {

    private final String baseUrl;
    private final Credentials credentials;
    private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
    private @Nullable RabbitRestTransport transport;
    private boolean verifyTls = true;
    private @Nullable Duration timeout;

    /**
     * Creates a builder with the required client parameters.
     *
     * @param baseUrl the management API root, e.g. {@code http://localhost:15672}
     * @param credentials the authentication credentials
     */
    public Builder(String baseUrl, Credentials credentials) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /** Sets the transport implementation. Defaults to a new {@link HttpClientTransport}. */
    public Builder transport(RabbitRestTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Sets whether to verify TLS certificates. Defaults to {@code true}. */
    public Builder verifyTls(boolean verifyTls) {
      this.verifyTls = verifyTls;
      return this;
    }

    /** Sets the per-request timeout. Defaults to {@code null}, the transport's own default. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Adds a header sent with every request. {@code Content-Type} cannot be changed here; it is
     * always {@code application/json}.
     */
    public Builder defaultHeader(String name, String value) {
      defaultHeaders.put(
          Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /**
     * Builds the client.
     *
     * @return the configured client
     * @throws IllegalArgumentException if the timeout is zero or negative
     */
    public ResourceClient build() {
      ClientConfig config =
          new ClientConfig(baseUrl, credentials, defaultHeaders, verifyTls, timeout);
      RabbitRestTransport activeTransport =
          transport != null ? transport : new HttpClientTransport();
      return new ResourceClient(config, activeTransport);
    }
  }
}

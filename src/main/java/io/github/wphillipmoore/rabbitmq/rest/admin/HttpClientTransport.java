package io.github.wphillipmoore.rabbitmq.rest.admin;

import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestArgumentException;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestTransportException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based implementation of {@link RabbitRestTransport}.
 *
 * <p>Requests are issued with {@link HttpClient#sendAsync}, so the calling thread never blocks.
 * One client instance is shared by all calls, which lets the JDK pool connections to the broker.
 */
public final class HttpClientTransport implements RabbitRestTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientTransport.class);

  private final HttpClient client;
  private @Nullable HttpClient nonVerifyingClient;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client = HttpClient.newHttpClient();
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, e.g. one trusting a private CA.
   *
   * @param sslContext the SSL context to use
   */
  public HttpClientTransport(SSLContext sslContext) {
    Objects.requireNonNull(sslContext, "sslContext");
    this.client = HttpClient.newBuilder().sslContext(sslContext).build();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  @SuppressWarnings("PMD.CloseResource") // HttpClient is managed by this transport, not disposable
  public CompletableFuture<TransportResponse> send(
      String method,
      String url,
      @Nullable String body,
      Map<String, String> headers,
      @Nullable Duration timeout,
      boolean verifyTls) {
    HttpClient activeClient = verifyTls ? client : getNonVerifyingClient();

    HttpRequest request = buildRequest(method, url, body, headers, timeout);

    LOGGER.debug("Sending {} {}", method, url);
    return activeClient
        .sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .handle(
            (response, failure) -> {
              if (failure != null) {
                Throwable cause = unwrap(failure);
                LOGGER.debug("{} {} failed: {}", method, url, cause.toString());
                throw new RabbitRestTransportException("HTTP request failed", method, url, cause);
              }
              LOGGER.debug("{} {} returned {}", method, url, response.statusCode());
              String responseBody = response.body() != null ? response.body() : "";
              return new TransportResponse(
                  response.statusCode(), responseBody, flattenHeaders(response.headers()));
            });
  }

  /**
   * Builds the request. The JDK rejects malformed URIs, restricted header names such as {@code
   * Host} or {@code Connection}, and header values containing CR or LF.
   *
   * @throws RabbitRestArgumentException if the JDK rejects any part of the request
   */
  static HttpRequest buildRequest(
      String method,
      String url,
      @Nullable String body,
      Map<String, String> headers,
      @Nullable Duration timeout) {
    HttpRequest.BodyPublisher publisher =
        body != null
            ? HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)
            : HttpRequest.BodyPublishers.noBody();
    try {
      HttpRequest.Builder requestBuilder =
          HttpRequest.newBuilder().uri(URI.create(url)).method(method, publisher);
      headers.forEach(requestBuilder::header);
      if (timeout != null) {
        requestBuilder.timeout(timeout);
      }
      return requestBuilder.build();
    } catch (IllegalArgumentException e) {
      throw new RabbitRestArgumentException(
          "Invalid request for " + method + " " + url + ": " + e.getMessage(), e);
    }
  }

  private synchronized HttpClient getNonVerifyingClient() {
    if (nonVerifyingClient == null) {
      SSLContext sslContext = createSslContext("TLS");
      nonVerifyingClient = HttpClient.newBuilder().sslContext(sslContext).build();
    }
    return nonVerifyingClient;
  }

  static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Creates an {@link SSLContext} with a trust-all manager.
   *
   * @param protocol the SSL protocol name (e.g. "TLS")
   * @return an initialized SSLContext that trusts all certificates
   * @throws IllegalStateException if the protocol is not available
   */
  static SSLContext createSslContext(String protocol) {
    try {
      SSLContext sslContext = SSLContext.getInstance(protocol);
      sslContext.init(null, new TrustManager[] {new TrustAllManager()}, null);
      return sslContext;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to create SSLContext", e);
    }
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }

  /** Accepts all certificates. Used when TLS verification is disabled. */
  static final class TrustAllManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // Accept all client certificates
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // Accept all server certificates
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}

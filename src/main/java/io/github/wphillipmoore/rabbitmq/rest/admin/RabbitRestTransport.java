package io.github.wphillipmoore.rabbitmq.rest.admin;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for RabbitMQ management API HTTP communication.
 *
 * <p>Implementations issue exactly one HTTP exchange per call and report every completed
 * exchange, whatever its status code, as a {@link TransportResponse}. Network or connection
 * failures must complete the returned future exceptionally with {@link
 * io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestTransportException}. A
 * request that cannot be built from the given arguments, e.g. because of a restricted header
 * name, is rejected synchronously with {@link
 * io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestArgumentException}.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface RabbitRestTransport {

  /**
   * Sends a request to the management API.
   *
   * @param method HTTP method ({@code GET}, {@code PUT}, {@code POST} or {@code DELETE})
   * @param url fully-qualified URL to send the request to
   * @param body request body text, or {@code null} to send no payload
   * @param headers HTTP headers to include in the request
   * @param timeout request timeout, or {@code null} for the transport's default
   * @param verifyTls whether to verify TLS certificates
   * @return a future completed with the transport response
   * @throws io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestArgumentException if
   *     the request cannot be built from the arguments
   */
  CompletableFuture<TransportResponse> send(
      String method,
      String url,
      @Nullable String body,
      Map<String, String> headers,
      @Nullable Duration timeout,
      boolean verifyTls);
}

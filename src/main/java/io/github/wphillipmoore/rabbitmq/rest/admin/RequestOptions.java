package io.github.wphillipmoore.rabbitmq.rest.admin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call request settings layered over the {@link ClientConfig}.
 *
 * <p>Headers given here override default headers of the same name; defaults not named here are
 * kept. Query parameters are appended to the URL in insertion order. Both maps are copied and
 * unmodifiable.
 *
 * @param headers extra headers for this call, never null
 * @param queryParameters query parameters for this call, never null
 */
public record RequestOptions(Map<String, String> headers, Map<String, String> queryParameters) {

  private static final RequestOptions NONE = new RequestOptions(Map.of(), Map.of());

  /** Validates and defensively copies both maps. */
  public RequestOptions {
    headers = copy(Objects.requireNonNull(headers, "headers"));
    queryParameters = copy(Objects.requireNonNull(queryParameters, "queryParameters"));
  }

  /** Returns options with no extra headers and no query parameters. */
  public static RequestOptions none() {
    return NONE;
  }

  /**
   * Returns options carrying only the given extra headers.
   *
   * @param headers extra headers for this call
   * @return the options
   */
  public static RequestOptions withHeaders(Map<String, String> headers) {
    return new RequestOptions(headers, Map.of());
  }

  /**
   * Returns options carrying only the given query parameters.
   *
   * @param queryParameters query parameters for this call
   * @return the options
   */
  public static RequestOptions withQuery(Map<String, String> queryParameters) {
    return new RequestOptions(Map.of(), queryParameters);
  }

  private static Map<String, String> copy(Map<String, String> source) {
    Map<String, String> copy = new LinkedHashMap<>();
    source.forEach(
        (key, value) ->
            copy.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value")));
    return Collections.unmodifiableMap(copy);
  }
}

package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Properties of an exchange declared through the management API.
 *
 * @param type the exchange type, e.g. {@code direct}, {@code fanout}, {@code topic}
 * @param durable whether the exchange survives a broker restart
 * @param autoDelete whether the exchange is deleted once its last binding is removed
 * @param internal whether publishers are barred from publishing to it directly
 * @param arguments optional exchange arguments, unmodifiable
 */
public record ExchangeDefinition(
    String type,
    boolean durable,
    boolean autoDelete,
    boolean internal,
    Map<String, Object> arguments) {

  /** Validates the type and defensively copies the arguments. */
  public ExchangeDefinition {
    Objects.requireNonNull(type, "type");
    arguments =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(arguments, "arguments")));
  }

  /**
   * Creates a durable, non-auto-delete, non-internal exchange definition with no arguments.
   *
   * @param type the exchange type
   */
  public ExchangeDefinition(String type) {
    this(type, true, false, false, Map.of());
  }

  /** Renders the PUT body. */
  public Map<String, Object> toBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("type", type);
    body.put("durable", durable);
    body.put("auto_delete", autoDelete);
    body.put("internal", internal);
    body.put("arguments", new LinkedHashMap<>(arguments));
    return body;
  }
}

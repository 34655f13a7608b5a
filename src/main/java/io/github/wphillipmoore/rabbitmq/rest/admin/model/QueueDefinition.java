package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Properties of a queue declared through the management API.
 *
 * <p>The queue type is passed as the {@code x-queue-type} argument, e.g. {@code quorum}.
 *
 * @param durable whether the queue survives a broker restart
 * @param autoDelete whether the queue is deleted once its last consumer unsubscribes
 * @param arguments optional queue arguments, unmodifiable
 */
public record QueueDefinition(boolean durable, boolean autoDelete, Map<String, Object> arguments) {

  /** Defensively copies the arguments. */
  public QueueDefinition {
    arguments =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(arguments, "arguments")));
  }

  /** Creates a durable, non-auto-delete queue definition with no arguments. */
  public QueueDefinition() {
    this(true, false, Map.of());
  }

  /** Renders the PUT body. */
  public Map<String, Object> toBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("durable", durable);
    body.put("auto_delete", autoDelete);
    body.put("arguments", new LinkedHashMap<>(arguments));
    return body;
  }
}

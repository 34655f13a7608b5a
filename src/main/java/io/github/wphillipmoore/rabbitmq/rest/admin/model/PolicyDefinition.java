package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A policy applied to the exchanges and/or queues of a virtual host whose names match a pattern.
 *
 * @param pattern regex matched against exchange or queue names
 * @param definition the policy keys and values, e.g. {@code {"max-length": 1000}}, unmodifiable
 * @param priority higher priorities win when several policies match
 * @param applyTo what the policy applies to: {@code all}, {@code queues} or {@code exchanges}
 */
public record PolicyDefinition(
    String pattern, Map<String, Object> definition, int priority, String applyTo) {

  /** Applies to exchanges and queues. */
  public static final String APPLY_TO_ALL = "all";

  /** Applies to queues only. */
  public static final String APPLY_TO_QUEUES = "queues";

  /** Applies to exchanges only. */
  public static final String APPLY_TO_EXCHANGES = "exchanges";

  /** Validates fields and defensively copies the definition. */
  public PolicyDefinition {
    Objects.requireNonNull(pattern, "pattern");
    definition =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(definition, "definition")));
    Objects.requireNonNull(applyTo, "applyTo");
  }

  /**
   * Creates a priority-0 policy that applies to exchanges and queues.
   *
   * @param pattern regex matched against exchange or queue names
   * @param definition the policy keys and values
   */
  public PolicyDefinition(String pattern, Map<String, Object> definition) {
    this(pattern, definition, 0, APPLY_TO_ALL);
  }

  /** Renders the PUT body. */
  public Map<String, Object> toBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("pattern", pattern);
    body.put("definition", new LinkedHashMap<>(definition));
    body.put("priority", priority);
    body.put("apply-to", applyTo);
    return body;
  }
}

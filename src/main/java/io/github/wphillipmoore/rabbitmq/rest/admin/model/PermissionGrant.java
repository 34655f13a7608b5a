package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The configure, write and read permissions of a user in one virtual host. Each value is a
 * regular expression matched against resource names.
 *
 * @param configure regex of resources the user may declare and delete
 * @param write regex of resources the user may publish to
 * @param read regex of resources the user may consume from
 */
public record PermissionGrant(String configure, String write, String read) {

  /** Full access to every resource in the virtual host. */
  public static final PermissionGrant ALL = new PermissionGrant(".*", ".*", ".*");

  /** No access to any resource in the virtual host. */
  public static final PermissionGrant NONE = new PermissionGrant("", "", "");

  /** Validates that all three patterns are non-null. */
  public PermissionGrant {
    Objects.requireNonNull(configure, "configure");
    Objects.requireNonNull(write, "write");
    Objects.requireNonNull(read, "read");
  }

  /** Renders the PUT body. */
  public Map<String, Object> toBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("configure", configure);
    body.put("write", write);
    body.put("read", read);
    return body;
  }
}

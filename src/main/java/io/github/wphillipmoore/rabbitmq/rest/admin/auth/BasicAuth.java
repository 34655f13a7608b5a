package io.github.wphillipmoore.rabbitmq.rest.admin.auth;

import java.util.Objects;

/**
 * Basic authentication credentials for the RabbitMQ management API.
 *
 * <p>Used to construct an {@code Authorization: Basic} header that is attached to every request.
 *
 * @param username the username, never null
 * @param password the password, never null
 */
public record BasicAuth(String username, String password) implements Credentials {

  /** Validates that username and password are non-null. */
  public BasicAuth {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }
}

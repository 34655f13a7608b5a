package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import java.util.Objects;

/**
 * A plaintext password, hashed by the broker. An empty password is accepted and creates a user
 * that cannot log in with a password.
 *
 * @param value the password, never null
 */
public record PlainPassword(String value) implements UserCredential {

  static final String FIELD = "password";

  /** Validates that the password is non-null. */
  public PlainPassword {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String fieldName() {
    return FIELD;
  }

  /** Masks the password. */
  @Override
  public String toString() {
    return "PlainPassword[value=***]";
  }
}

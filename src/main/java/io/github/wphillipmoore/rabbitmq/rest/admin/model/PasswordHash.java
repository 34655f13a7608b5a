package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import java.util.Objects;

/**
 * A password hash computed by the caller in the broker's configured hashing scheme.
 *
 * @param value the encoded hash, never null
 */
public record PasswordHash(String value) implements UserCredential {

  static final String FIELD = "password_hash";

  /** Validates that the hash is non-null. */
  public PasswordHash {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String fieldName() {
    return FIELD;
  }
}

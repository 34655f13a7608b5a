package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestArgumentException;
import org.jspecify.annotations.Nullable;

/**
 * The secret a new broker user authenticates with: either a plaintext password or a password
 * hash computed ahead of time. The broker accepts exactly one of the two in the user body.
 */
public sealed interface UserCredential permits PlainPassword, PasswordHash {

  /** Returns the user body field this credential is sent as. */
  String fieldName();

  /** Returns the credential value. */
  String value();

  /**
   * Resolves a pair of optional arguments into a credential.
   *
   * <p>An empty password next to a hash counts as not supplied, so {@code of("", hash)} yields
   * the hash. On its own, an empty password is a valid plaintext password.
   *
   * @param password the plaintext password, or {@code null}
   * @param passwordHash the precomputed password hash, or {@code null}
   * @return the credential for whichever argument was supplied
   * @throws RabbitRestArgumentException if both or neither are supplied
   */
  static UserCredential of(@Nullable String password, @Nullable String passwordHash) {
    if (passwordHash != null) {
      if (password != null && !password.isEmpty()) {
        throw new RabbitRestArgumentException(
            "Supply either password or passwordHash for a user, not both");
      }
      return new PasswordHash(passwordHash);
    }
    if (password != null) {
      return new PlainPassword(password);
    }
    throw new RabbitRestArgumentException("Supply either password or passwordHash for a user");
  }
}

package io.github.wphillipmoore.rabbitmq.rest.admin.auth;

import java.util.Objects;

/**
 * A pre-built {@code Authorization} header value, for deployments that front the management API
 * with something other than plain Basic authentication (for example an OAuth 2 bearer token).
 *
 * <p>The value is sent verbatim, e.g. {@code "Bearer eyJhbGciOi..."}.
 *
 * @param authorization the complete header value, never null or blank
 */
public record PrebuiltAuth(String authorization) implements Credentials {

  /** Validates that the header value is non-null and non-blank. */
  public PrebuiltAuth {
    Objects.requireNonNull(authorization, "authorization");
    if (authorization.isBlank()) {
      throw new IllegalArgumentException("authorization must not be blank");
    }
  }

  /**
   * Creates bearer-token credentials.
   *
   * @param token the bearer token, never null
   * @return credentials sending {@code Authorization: Bearer <token>}
   */
  public static PrebuiltAuth bearer(String token) {
    Objects.requireNonNull(token, "token");
    return new PrebuiltAuth("Bearer " + token);
  }
}

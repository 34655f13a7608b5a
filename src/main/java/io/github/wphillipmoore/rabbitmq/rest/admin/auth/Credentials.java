package io.github.wphillipmoore.rabbitmq.rest.admin.auth;

/**
 * Sealed credential type for RabbitMQ management API authentication.
 *
 * <p>The resource client resolves the concrete type into an {@code Authorization} header value
 * once, at construction time, using {@code instanceof} pattern matching.
 */
public sealed interface Credentials permits BasicAuth, PrebuiltAuth {}

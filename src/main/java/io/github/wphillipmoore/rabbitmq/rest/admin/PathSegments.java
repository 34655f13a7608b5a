package io.github.wphillipmoore.rabbitmq.rest.admin;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds management API paths from caller-supplied names.
 *
 * <p>Every segment is percent-encoded, including {@code /}: the default virtual host is named
 * {@code "/"} and must travel as {@code %2F}, not as an extra path separator.
 */
public final class PathSegments {

  private PathSegments() {}

  /**
   * Percent-encodes a single path segment.
   *
   * @param segment the raw segment, e.g. a vhost or queue name
   * @return the encoded segment
   */
  public static String encode(String segment) {
    Objects.requireNonNull(segment, "segment");
    // URLEncoder targets form encoding; a path segment needs %20 for spaces
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  /**
   * Appends encoded segments to a fixed path prefix.
   *
   * @param prefix a literal path beginning with {@code /}, e.g. {@code /api/exchanges}
   * @param segments raw segments, each encoded and joined with {@code /}
   * @return the complete path
   */
  public static String path(String prefix, String... segments) {
    StringBuilder path = new StringBuilder(Objects.requireNonNull(prefix, "prefix"));
    for (String segment : segments) {
      path.append('/').append(encode(segment));
    }
    return path.toString();
  }
}

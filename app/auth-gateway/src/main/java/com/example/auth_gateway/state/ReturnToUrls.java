package com.example.auth_gateway.state;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

/** Resolution rules for post-login and post-logout return URLs. */
public final class ReturnToUrls {

  private ReturnToUrls() {}

  /**
   * Resolves an end-user supplied return URL against the origin of {@code safeBaseUrl}.
   *
   * <p>Only path-relative references are accepted. Absolute URLs, scheme-relative references
   * ({@code //host}) and backslash tricks are rejected, as is anything that would leave the
   * origin once resolved.
   *
   * @return the absolute URL, or empty when the candidate is rejected
   */
  public static Optional<String> toSafeRedirect(String candidate, String safeBaseUrl) {
    if (candidate == null || candidate.isBlank()) {
      return Optional.empty();
    }
    if (candidate.startsWith("//") || candidate.indexOf('\\') >= 0) {
      return Optional.empty();
    }
    final URI reference;
    final URI origin;
    try {
      reference = new URI(candidate);
      origin = originOf(new URI(safeBaseUrl));
    } catch (URISyntaxException | IllegalArgumentException ex) {
      return Optional.empty();
    }
    if (reference.getScheme() != null || reference.getRawAuthority() != null) {
      return Optional.empty();
    }
    final URI resolved = origin.resolve(reference);
    if (!Objects.equals(resolved.getScheme(), origin.getScheme())
        || !Objects.equals(resolved.getRawAuthority(), origin.getRawAuthority())) {
      return Optional.empty();
    }
    return Optional.of(resolved.toString());
  }

  /** Returns {@code url} when absolute, otherwise {@code url} joined to {@code baseUrl}. */
  public static String toAbsolute(String url, String baseUrl) {
    if (url == null || url.isBlank()) {
      return baseUrl;
    }
    if (isAbsolute(url)) {
      return url;
    }
    return join(baseUrl, url);
  }

  public static boolean isAbsolute(String url) {
    try {
      final URI uri = new URI(url);
      return uri.isAbsolute() && uri.getRawAuthority() != null;
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  static String join(String baseUrl, String path) {
    String base = baseUrl;
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String tail = path;
    while (tail.startsWith("/")) {
      tail = tail.substring(1);
    }
    return tail.isEmpty() ? base : base + "/" + tail;
  }

  private static URI originOf(URI uri) {
    if (uri.getScheme() == null || uri.getRawAuthority() == null) {
      throw new IllegalArgumentException("base url must be absolute");
    }
    return URI.create(uri.getScheme() + "://" + uri.getRawAuthority() + "/");
  }
}

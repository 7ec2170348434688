package com.example.auth_gateway.http;

/**
 * Attributes written with a cookie. A {@code null} {@link #sameSite()} omits the attribute, which
 * is how the legacy fallback cookies are written.
 */
public record CookieAttributes(
    boolean httpOnly, boolean secure, String domain, String path, SameSite sameSite) {

  public CookieAttributes {
    path = path == null || path.isBlank() ? "/" : path;
    domain = domain == null || domain.isBlank() ? null : domain;
  }

  public CookieAttributes withSameSite(SameSite value) {
    return new CookieAttributes(httpOnly, secure, domain, path, value);
  }

  public CookieAttributes withSecure(boolean value) {
    return new CookieAttributes(httpOnly, value, domain, path, sameSite);
  }
}

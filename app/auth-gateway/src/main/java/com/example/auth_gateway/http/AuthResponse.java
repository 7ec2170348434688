package com.example.auth_gateway.http;

/** Write side of the HTTP exchange used by the login, callback and logout handlers. */
public interface AuthResponse {

  void setCookie(String name, String value, CookieAttributes attributes);

  void clearCookie(String name, CookieAttributes attributes);

  /** Issues a 302 redirect to {@code location}. */
  void redirect(String location);
}

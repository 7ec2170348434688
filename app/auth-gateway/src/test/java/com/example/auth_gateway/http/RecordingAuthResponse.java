package com.example.auth_gateway.http;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Records cookie writes and the redirect issued by a handler. */
public class RecordingAuthResponse implements AuthResponse {

  public record WrittenCookie(String name, String value, CookieAttributes attributes) {}

  private final List<WrittenCookie> setCookies = new ArrayList<>();
  private final List<WrittenCookie> clearedCookies = new ArrayList<>();
  private String redirectLocation;

  @Override
  public void setCookie(String name, String value, CookieAttributes attributes) {
    setCookies.add(new WrittenCookie(name, value, attributes));
  }

  @Override
  public void clearCookie(String name, CookieAttributes attributes) {
    clearedCookies.add(new WrittenCookie(name, "", attributes));
  }

  @Override
  public void redirect(String location) {
    if (redirectLocation != null) {
      throw new IllegalStateException("redirect issued twice");
    }
    redirectLocation = location;
  }

  public List<WrittenCookie> setCookies() {
    return List.copyOf(setCookies);
  }

  public List<String> clearedCookieNames() {
    return clearedCookies.stream().map(WrittenCookie::name).toList();
  }

  public Optional<WrittenCookie> setCookie(String name) {
    WrittenCookie last = null;
    for (WrittenCookie cookie : setCookies) {
      if (cookie.name().equals(name)) {
        last = cookie;
      }
    }
    return Optional.ofNullable(last);
  }

  public Map<String, String> cookieValues() {
    final Map<String, String> values = new LinkedHashMap<>();
    setCookies.forEach(cookie -> values.put(cookie.name(), cookie.value()));
    return values;
  }

  public Optional<String> redirectLocation() {
    return Optional.ofNullable(redirectLocation);
  }
}

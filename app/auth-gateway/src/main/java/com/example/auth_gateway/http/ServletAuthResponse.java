package com.example.auth_gateway.http;

import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;

@RequiredArgsConstructor
public class ServletAuthResponse implements AuthResponse {

  private final HttpServletResponse response;

  @Override
  public void setCookie(String name, String value, CookieAttributes attributes) {
    response.addHeader(HttpHeaders.SET_COOKIE, build(name, value, attributes, null).toString());
  }

  @Override
  public void clearCookie(String name, CookieAttributes attributes) {
    response.addHeader(
        HttpHeaders.SET_COOKIE, build(name, "", attributes, Duration.ZERO).toString());
  }

  @Override
  public void redirect(String location) {
    response.setStatus(HttpStatus.FOUND.value());
    response.setHeader(HttpHeaders.LOCATION, location);
  }

  private ResponseCookie build(
      String name, String value, CookieAttributes attributes, Duration maxAge) {
    final ResponseCookie.ResponseCookieBuilder builder =
        ResponseCookie.from(name, value)
            .httpOnly(attributes.httpOnly())
            .secure(attributes.secure())
            .path(attributes.path());
    if (attributes.domain() != null) {
      builder.domain(attributes.domain());
    }
    if (attributes.sameSite() != null) {
      builder.sameSite(attributes.sameSite().attributeValue());
    }
    if (maxAge != null) {
      builder.maxAge(maxAge);
    }
    return builder.build();
  }
}

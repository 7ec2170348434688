package com.example.auth_gateway.http;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ServletAuthRequest implements AuthRequest {

  private final HttpServletRequest request;

  @Override
  public Map<String, String> getCookies() {
    final Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return Collections.emptyMap();
    }
    final Map<String, String> result = new LinkedHashMap<>();
    for (Cookie cookie : cookies) {
      result.putIfAbsent(cookie.getName(), cookie.getValue());
    }
    return result;
  }

  @Override
  public List<String> getParameterValues(String name) {
    final String[] values = request.getParameterValues(name);
    if (values == null) {
      return List.of();
    }
    return Arrays.asList(values);
  }
}

package com.example.auth_gateway.http;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read side of the HTTP exchange used by the login, callback and logout handlers. */
public interface AuthRequest {

  /** Cookies by name. When a name is sent more than once the first value is kept. */
  Map<String, String> getCookies();

  /** All values of a query parameter in request order, empty when absent. */
  List<String> getParameterValues(String name);

  default Optional<String> getFirstParameter(String name) {
    final List<String> values = getParameterValues(name);
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(0));
  }
}

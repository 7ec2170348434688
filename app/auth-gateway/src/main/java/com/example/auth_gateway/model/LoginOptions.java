package com.example.auth_gateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call login options.
 *
 * @param returnTo where to send the user after login; trusted, so absolute URLs are allowed
 * @param authorizationParams extra authorization request parameters, highest precedence
 * @param loginStateProvider optional hook adding application data to the state
 */
public record LoginOptions(
    String returnTo,
    Map<String, String> authorizationParams,
    LoginStateProvider loginStateProvider) {

  public LoginOptions {
    authorizationParams =
        authorizationParams == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(authorizationParams));
  }

  public static LoginOptions empty() {
    return new LoginOptions(null, null, null);
  }

  public LoginOptions withReturnTo(String value) {
    return new LoginOptions(value, authorizationParams, loginStateProvider);
  }
}

package com.example.auth_gateway.model;

import java.util.Map;

/**
 * @param returnTo where to send the user after logout; relative values are joined to the base URL
 * @param logoutParams extra end-session request parameters
 */
public record LogoutOptions(String returnTo, Map<String, String> logoutParams) {

  public LogoutOptions {
    returnTo = returnTo == null || returnTo.isBlank() ? null : returnTo;
    logoutParams = logoutParams == null ? Map.of() : Map.copyOf(logoutParams);
  }

  public static LogoutOptions empty() {
    return new LogoutOptions(null, null);
  }
}

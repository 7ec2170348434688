package com.example.auth_gateway.model;

/**
 * Per-call callback options.
 *
 * @param redirectUri the {@code redirect_uri} sent to the token endpoint; must match the one used
 *     when the login started. {@code null} uses the configured or default callback URL.
 */
public record CallbackOptions(String redirectUri) {

  public static CallbackOptions empty() {
    return new CallbackOptions(null);
  }
}

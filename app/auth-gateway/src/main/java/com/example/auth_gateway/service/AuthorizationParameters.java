package com.example.auth_gateway.service;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.state.ReturnToUrls;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Merges authorization request parameter layers given in increasing precedence. */
public final class AuthorizationParameters {

  public static final String RESPONSE_TYPE = "response_type";
  public static final String RESPONSE_MODE = "response_mode";
  public static final String REDIRECT_URI = "redirect_uri";
  public static final String SCOPE = "scope";
  public static final String ORGANIZATION = "organization";
  public static final String STATE = "state";
  public static final String NONCE = "nonce";
  public static final String CODE_CHALLENGE = "code_challenge";
  public static final String CODE_CHALLENGE_METHOD = "code_challenge_method";
  public static final String CLIENT_ID = "client_id";

  private AuthorizationParameters() {}

  /** Callback route joined to the base URL. */
  public static String defaultRedirectUri(AuthProperties properties) {
    return ReturnToUrls.toAbsolute(properties.routes().callback(), properties.baseUrl());
  }

  /** Later layers win. Null layers and null values are skipped. */
  public static Map<String, String> merge(List<Map<String, String>> layers) {
    final Map<String, String> merged = new LinkedHashMap<>();
    for (Map<String, String> layer : layers) {
      if (layer == null) {
        continue;
      }
      layer.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              merged.put(key, value);
            }
          });
    }
    return Collections.unmodifiableMap(merged);
  }
}

package com.example.auth_gateway.service;

import com.example.auth_gateway.model.TokenSet;
import java.util.Map;

/** Identity provider operations used by the login, callback and logout handlers. */
public interface OidcClient {

  /** Absolute authorize endpoint URL carrying {@code client_id} and {@code params}. */
  String authorizationUrl(Map<String, String> params);

  /** Absolute end-session endpoint URL carrying {@code client_id} and {@code params}. */
  String endSessionUrl(Map<String, String> params);

  /** Redeems an authorization code at the token endpoint. */
  TokenSet exchangeCode(String code, String redirectUri, String codeVerifier);
}

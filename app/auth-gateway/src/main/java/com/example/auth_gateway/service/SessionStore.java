package com.example.auth_gateway.service;

import com.example.auth_gateway.http.AuthRequest;
import com.example.auth_gateway.http.AuthResponse;
import com.example.auth_gateway.model.TokenSet;
import java.util.Optional;

public interface SessionStore {

  boolean isAuthenticated(AuthRequest request, AuthResponse response);

  Optional<String> getIdToken(AuthRequest request, AuthResponse response);

  /** Starts a new session for {@code tokenSet}, replacing any session the request carried. */
  void create(AuthRequest request, AuthResponse response, TokenSet tokenSet);

  void delete(AuthRequest request, AuthResponse response);
}

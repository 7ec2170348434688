package com.example.auth_gateway.model;

import com.example.auth_gateway.http.AuthRequest;
import java.util.Map;

/**
 * Supplies application data to carry through the login round trip. The returned entries are
 * merged over the default state; a {@code returnTo} entry replaces the resolved return URL.
 * Returning {@code null} fails the login.
 */
@FunctionalInterface
public interface LoginStateProvider {

  Map<String, Object> getLoginState(AuthRequest request, LoginOptions options);
}

package com.example.auth_gateway.service;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.http.AuthRequest;
import com.example.auth_gateway.http.AuthResponse;
import com.example.auth_gateway.model.LogoutOptions;
import com.example.auth_gateway.model.LogoutOutcome;
import com.example.auth_gateway.state.ReturnToUrls;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OidcLogoutService {

  private static final Logger logger = LoggerFactory.getLogger(OidcLogoutService.class);

  private final AuthProperties properties;
  private final SessionStore sessionStore;
  private final OidcClient oidcClient;

  /**
   * Ends the local session and, when identity provider logout is enabled, the provider session.
   * Calling it without a session only redirects.
   */
  public LogoutOutcome logout(AuthRequest request, AuthResponse response, LogoutOptions options) {
    final LogoutOptions effectiveOptions = options == null ? LogoutOptions.empty() : options;
    try {
      return doLogout(request, response, effectiveOptions);
    } catch (RuntimeException ex) {
      logger.warn("logout failed: {}", ex.getMessage());
      throw new AuthHandlerException(AuthHandlerException.Phase.LOGOUT, ex);
    }
  }

  private LogoutOutcome doLogout(
      AuthRequest request, AuthResponse response, LogoutOptions options) {
    final String returnTo =
        ReturnToUrls.toAbsolute(
            options.returnTo() != null
                ? options.returnTo()
                : properties.routes().postLogoutRedirect(),
            properties.baseUrl());
    logger.debug("logout with return url {}", returnTo);

    if (!sessionStore.isAuthenticated(request, response)) {
      logger.debug("end-user already logged out, redirecting to {}", returnTo);
      response.redirect(returnTo);
      return LogoutOutcome.ALREADY_LOGGED_OUT;
    }

    final Optional<String> idToken = sessionStore.getIdToken(request, response);
    sessionStore.delete(request, response);

    if (!properties.idpLogout()) {
      logger.debug("performing a local only logout, redirecting to {}", returnTo);
      response.redirect(returnTo);
      return LogoutOutcome.LOCAL;
    }

    final Map<String, String> params = new LinkedHashMap<>(options.logoutParams());
    params.put("post_logout_redirect_uri", returnTo);
    idToken.ifPresent(value -> params.put("id_token_hint", value));
    final String endSessionUrl = oidcClient.endSessionUrl(params);
    logger.debug("logging out of identity provider");
    response.redirect(endSessionUrl);
    return LogoutOutcome.IDENTITY_PROVIDER;
  }
}

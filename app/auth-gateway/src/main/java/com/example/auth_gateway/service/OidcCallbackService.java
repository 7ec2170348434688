package com.example.auth_gateway.service;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.cookie.TransientStore;
import com.example.auth_gateway.http.AuthRequest;
import com.example.auth_gateway.http.AuthResponse;
import com.example.auth_gateway.model.CallbackOptions;
import com.example.auth_gateway.model.TokenSet;
import com.example.auth_gateway.state.LoginStateCodec;
import com.example.auth_gateway.state.ReturnToUrls;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

// IdP から戻ったリクエストを一時 Cookie と突き合わせ、セッションを発行する。
@Service
public class OidcCallbackService {

  private static final Logger logger = LoggerFactory.getLogger(OidcCallbackService.class);

  private final AuthProperties properties;
  private final TransientStore transientStore;
  private final LoginStateCodec stateCodec;
  private final OidcClient oidcClient;
  private final IdTokenNonceVerifier nonceVerifier;
  private final SessionStore sessionStore;
  private final String redirectUri;

  public OidcCallbackService(
      AuthProperties properties,
      TransientStore transientStore,
      LoginStateCodec stateCodec,
      OidcClient oidcClient,
      IdTokenNonceVerifier nonceVerifier,
      SessionStore sessionStore) {
    this.properties = properties;
    this.transientStore = transientStore;
    this.stateCodec = stateCodec;
    this.oidcClient = oidcClient;
    this.nonceVerifier = nonceVerifier;
    this.sessionStore = sessionStore;
    this.redirectUri =
        properties
            .authorizationParams()
            .getOrDefault(
                AuthorizationParameters.REDIRECT_URI,
                AuthorizationParameters.defaultRedirectUri(properties));
  }

  /**
   * Completes the login and redirects to the return URL carried in the state.
   *
   * @throws ProtocolStateMissingException when the transient state is missing or does not match
   * @throws AuthHandlerException when the identity provider reports an error or the exchange fails
   */
  public void callback(AuthRequest request, AuthResponse response) {
    callback(request, response, CallbackOptions.empty());
  }

  /**
   * Same as {@link #callback(AuthRequest, AuthResponse)}. A login started with a {@code
   * redirect_uri} override must pass the same value here.
   */
  public void callback(AuthRequest request, AuthResponse response, CallbackOptions options) {
    final String exchangeRedirectUri =
        options == null || options.redirectUri() == null ? redirectUri : options.redirectUri();
    // 3 つとも必ず読み出して Cookie を消す。
    final Optional<String> expectedState =
        transientStore.read(OidcLoginService.STATE_COOKIE, request, response);
    final Optional<String> nonce =
        transientStore.read(OidcLoginService.NONCE_COOKIE, request, response);
    final Optional<String> codeVerifier =
        transientStore.read(OidcLoginService.CODE_VERIFIER_COOKIE, request, response);

    if (expectedState.isEmpty()) {
      logger.warn("callback without a valid state cookie");
      throw new ProtocolStateMissingException("state cookie is missing or invalid");
    }
    final Optional<String> receivedState = request.getFirstParameter(AuthorizationParameters.STATE);
    if (receivedState.isEmpty() || !sameValue(expectedState.get(), receivedState.get())) {
      logger.warn("callback state mismatch");
      throw new ProtocolStateMissingException("state mismatch");
    }

    final Optional<String> error = request.getFirstParameter("error");
    if (error.isPresent()) {
      final String description = request.getFirstParameter("error_description").orElse("");
      throw new AuthHandlerException(
          AuthHandlerException.Phase.CALLBACK,
          new OidcIntegrationException(
              OidcIntegrationException.Reason.REJECTED,
              description.isBlank() ? error.get() : error.get() + " (" + description + ")"));
    }
    final Optional<String> code =
        request.getFirstParameter("code").filter(value -> !value.isBlank());
    if (code.isEmpty()) {
      throw new ProtocolStateMissingException("code is missing");
    }
    if (codeVerifier.isEmpty() || nonce.isEmpty()) {
      logger.warn("callback without a valid nonce or code_verifier cookie");
      throw new ProtocolStateMissingException("nonce or code_verifier cookie is missing or invalid");
    }

    try {
      final TokenSet tokenSet =
          oidcClient.exchangeCode(code.get(), exchangeRedirectUri, codeVerifier.get());
      nonceVerifier.verify(tokenSet.idToken(), nonce.get());
      sessionStore.create(request, response, tokenSet);
    } catch (ProtocolStateMissingException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("callback failed: {}", ex.getMessage());
      throw new AuthHandlerException(AuthHandlerException.Phase.CALLBACK, ex);
    }

    final String returnTo = returnTo(expectedState.get());
    logger.debug("login completed, redirecting to {}", returnTo);
    response.redirect(returnTo);
  }

  private String returnTo(String encodedState) {
    final Object value =
        stateCodec
            .decodeState(encodedState)
            .map(state -> state.get(OidcLoginService.RETURN_TO))
            .orElse(null);
    if (value instanceof String returnTo && !returnTo.isBlank()) {
      return ReturnToUrls.toAbsolute(returnTo, properties.baseUrl());
    }
    return properties.baseUrl();
  }

  private boolean sameValue(String expected, String received) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), received.getBytes(StandardCharsets.UTF_8));
  }
}

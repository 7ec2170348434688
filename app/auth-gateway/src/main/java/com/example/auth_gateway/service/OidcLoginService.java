/*
 * どこで: Auth-Gateway サービス層
 * 何を: state/nonce/PKCE を生成して一時 Cookie に保存し、IdP の authorize endpoint へリダイレクトする
 * なぜ: /callback で CSRF・リプレイ・コード横取りを検出できるようにするため
 */
package com.example.auth_gateway.service;

import static com.example.auth_gateway.service.AuthorizationParameters.CODE_CHALLENGE;
import static com.example.auth_gateway.service.AuthorizationParameters.CODE_CHALLENGE_METHOD;
import static com.example.auth_gateway.service.AuthorizationParameters.NONCE;
import static com.example.auth_gateway.service.AuthorizationParameters.ORGANIZATION;
import static com.example.auth_gateway.service.AuthorizationParameters.REDIRECT_URI;
import static com.example.auth_gateway.service.AuthorizationParameters.RESPONSE_MODE;
import static com.example.auth_gateway.service.AuthorizationParameters.RESPONSE_TYPE;
import static com.example.auth_gateway.service.AuthorizationParameters.SCOPE;
import static com.example.auth_gateway.service.AuthorizationParameters.STATE;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.cookie.TransientCookieOptions;
import com.example.auth_gateway.cookie.TransientStore;
import com.example.auth_gateway.http.AuthRequest;
import com.example.auth_gateway.http.AuthResponse;
import com.example.auth_gateway.http.SameSite;
import com.example.auth_gateway.model.LoginOptions;
import com.example.auth_gateway.state.LoginStateCodec;
import com.example.auth_gateway.state.ReturnToUrls;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OidcLoginService {

  public static final String NONCE_COOKIE = "nonce";
  public static final String STATE_COOKIE = "state";
  public static final String CODE_VERIFIER_COOKIE = "code_verifier";
  public static final String RETURN_TO = "returnTo";

  static final String DEFAULT_SCOPE = "openid profile email";
  private static final String CODE_RESPONSE_TYPE = "code";

  private static final Logger logger = LoggerFactory.getLogger(OidcLoginService.class);

  private final AuthProperties properties;
  private final TransientStore transientStore;
  private final LoginStateCodec stateCodec;
  private final OidcRandomValues randomValues;
  private final OidcClient oidcClient;

  public OidcLoginService(
      AuthProperties properties,
      TransientStore transientStore,
      LoginStateCodec stateCodec,
      OidcRandomValues randomValues,
      OidcClient oidcClient) {
    this.properties = properties;
    this.transientStore = transientStore;
    this.stateCodec = stateCodec;
    this.randomValues = randomValues;
    this.oidcClient = oidcClient;
  }

  /**
   * Starts the authorization code flow and redirects to the identity provider.
   *
   * @throws AuthHandlerException when the request cannot be built; nothing is redirected then
   */
  public void login(AuthRequest request, AuthResponse response, LoginOptions options) {
    final LoginOptions effectiveOptions = options == null ? LoginOptions.empty() : options;
    try {
      doLogin(request, response, effectiveOptions);
    } catch (AuthHandlerException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("login failed: {}", ex.getMessage());
      throw new AuthHandlerException(AuthHandlerException.Phase.LOGIN, ex);
    }
  }

  private void doLogin(AuthRequest request, AuthResponse response, LoginOptions options) {
    final Map<String, String> authorizationParams = authorizationParams(options);
    validate(authorizationParams);

    final String returnTo =
        resolveReturnTo(request, options, authorizationParams.get(REDIRECT_URI));
    final String encodedState = encodeState(buildLoginState(request, options, returnTo));

    final SameSite sameSite =
        "form_post".equals(authorizationParams.get(RESPONSE_MODE))
            ? SameSite.NONE
            : properties.cookieAttributes().sameSite();
    final String nonce =
        transientStore.save(
            NONCE_COOKIE, response, TransientCookieOptions.of(randomValues.nonce(), sameSite));
    final String state =
        transientStore.save(
            STATE_COOKIE, response, TransientCookieOptions.of(encodedState, sameSite));
    final String codeVerifier =
        transientStore.save(
            CODE_VERIFIER_COOKIE,
            response,
            TransientCookieOptions.of(randomValues.codeVerifier(), sameSite));

    final Map<String, String> requestParams = new LinkedHashMap<>(authorizationParams);
    requestParams.put(NONCE, nonce);
    requestParams.put(STATE, state);
    requestParams.put(CODE_CHALLENGE, OidcRandomValues.codeChallenge(codeVerifier));
    requestParams.put(CODE_CHALLENGE_METHOD, OidcRandomValues.CODE_CHALLENGE_METHOD);

    final String authorizationUrl = oidcClient.authorizationUrl(requestParams);
    logger.debug("redirecting to identity provider returnTo={}", returnTo);
    response.redirect(authorizationUrl);
  }

  /** defaults < configuration < configured organization < caller options. */
  private Map<String, String> authorizationParams(LoginOptions options) {
    final Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put(RESPONSE_TYPE, CODE_RESPONSE_TYPE);
    defaults.put(SCOPE, DEFAULT_SCOPE);
    defaults.put(REDIRECT_URI, AuthorizationParameters.defaultRedirectUri(properties));
    final Map<String, String> organization = new LinkedHashMap<>();
    if (properties.organization() != null) {
      organization.put(ORGANIZATION, properties.organization());
    }
    return AuthorizationParameters.merge(
        List.of(
            defaults,
            properties.authorizationParams(),
            organization,
            options.authorizationParams()));
  }

  private void validate(Map<String, String> authorizationParams) {
    if (!CODE_RESPONSE_TYPE.equals(authorizationParams.get(RESPONSE_TYPE))) {
      throw new IllegalArgumentException("response_type should be one of: code");
    }
    final String scope = authorizationParams.get(SCOPE);
    if (scope == null || !Arrays.asList(scope.split(" ")).contains("openid")) {
      throw new IllegalArgumentException("scope should contain \"openid\"");
    }
  }

  private String resolveReturnTo(AuthRequest request, LoginOptions options, String redirectUri) {
    String returnTo = properties.baseUrl();
    final List<String> fromQuery = request.getParameterValues(RETURN_TO);
    if (fromQuery != null && !fromQuery.isEmpty()) {
      returnTo = ReturnToUrls.toSafeRedirect(fromQuery.get(0), redirectUri).orElse(null);
      if (returnTo == null) {
        logger.warn("rejected returnTo from querystring");
      }
    }
    if (options.returnTo() != null) {
      returnTo = options.returnTo();
    }
    return returnTo;
  }

  private Map<String, Object> buildLoginState(
      AuthRequest request, LoginOptions options, String returnTo) {
    final Map<String, Object> state = new LinkedHashMap<>();
    if (returnTo != null) {
      state.put(RETURN_TO, returnTo);
    }
    if (options.loginStateProvider() == null) {
      return state;
    }
    final Map<String, Object> custom =
        options.loginStateProvider().getLoginState(request, options.withReturnTo(returnTo));
    if (custom == null) {
      throw new InvalidCustomStateException("Custom state value must be an object.");
    }
    state.putAll(custom);
    return state;
  }

  private String encodeState(Map<String, Object> state) {
    try {
      return stateCodec.encodeState(state);
    } catch (IllegalArgumentException ex) {
      throw new InvalidCustomStateException("Custom state value must be an object.", ex);
    }
  }
}

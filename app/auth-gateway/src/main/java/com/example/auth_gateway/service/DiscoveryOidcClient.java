/*
 * どこで: Auth-Gateway サービス層
 * 何を: OIDC discovery で得たエンドポイントへ authorize/end-session URL を組み立て、code を token に交換する
 * なぜ: IdP ごとの URL 差異を discovery に吸収させ、失敗理由を OidcIntegrationException に統一するため
 */
package com.example.auth_gateway.service;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.model.OidcProviderMetadata;
import com.example.auth_gateway.model.TokenSet;
import com.google.common.annotations.VisibleForTesting;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class DiscoveryOidcClient implements OidcClient {

  private static final Logger logger = LoggerFactory.getLogger(DiscoveryOidcClient.class);
  private static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

  private final RestClient oidcRestClient;
  private final String issuerBaseUrl;
  private final String clientId;
  private final String clientSecret;
  private volatile OidcProviderMetadata metadata;

  public DiscoveryOidcClient(RestClient oidcRestClient, AuthProperties properties) {
    this.oidcRestClient = oidcRestClient;
    this.issuerBaseUrl = trimTrailingSlash(properties.issuerBaseUrl());
    this.clientId = properties.clientId();
    this.clientSecret = properties.clientSecret();
  }

  @Override
  public String authorizationUrl(Map<String, String> params) {
    return withQuery(metadata().authorizationEndpoint(), params);
  }

  @Override
  public String endSessionUrl(Map<String, String> params) {
    final String endpoint = metadata().endSessionEndpoint();
    if (isBlank(endpoint)) {
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_RESPONSE,
          "end_session_endpoint is not advertised by the identity provider");
    }
    return withQuery(endpoint, params);
  }

  @Override
  public TokenSet exchangeCode(String code, String redirectUri, String codeVerifier) {
    if (isBlank(code)) {
      throw new IllegalArgumentException("code is required");
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", redirectUri);
    form.add("code_verifier", codeVerifier);
    form.add("client_id", clientId);
    if (!isBlank(clientSecret)) {
      form.add("client_secret", clientSecret);
    }
    final TokenSet tokenSet =
        call(
            "token",
            () ->
                oidcRestClient
                    .post()
                    .uri(metadata().tokenEndpoint())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(TokenSet.class));
    if (tokenSet == null || isBlank(tokenSet.idToken())) {
      logger.warn("oidc token response validation failed");
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_RESPONSE, "token response has no id_token");
    }
    return tokenSet;
  }

  @VisibleForTesting
  OidcProviderMetadata metadata() {
    OidcProviderMetadata current = metadata;
    if (current == null) {
      current = discover();
      metadata = current;
    }
    return current;
  }

  private OidcProviderMetadata discover() {
    final OidcProviderMetadata discovered =
        call(
            "discovery",
            () ->
                oidcRestClient
                    .get()
                    .uri(issuerBaseUrl + DISCOVERY_PATH)
                    .retrieve()
                    .body(OidcProviderMetadata.class));
    if (discovered == null
        || isBlank(discovered.authorizationEndpoint())
        || isBlank(discovered.tokenEndpoint())) {
      logger.warn("oidc discovery document validation failed issuer={}", issuerBaseUrl);
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_RESPONSE, "discovery document is invalid");
    }
    logger.debug("oidc discovery completed issuer={}", discovered.issuer());
    return discovered;
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "oidc {} failed with http status={} statusText={}",
          operation,
          ex.getStatusCode().value(),
          ex.getStatusText());
      if (ex.getStatusCode().is5xxServerError()) {
        throw new OidcIntegrationException(
            OidcIntegrationException.Reason.BAD_GATEWAY, "oidc " + operation + " server error", ex);
      }
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.REJECTED, "oidc " + operation + " rejected", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("oidc {} timed out", operation);
        throw new OidcIntegrationException(
            OidcIntegrationException.Reason.TIMEOUT, "oidc " + operation + " timeout", ex);
      }
      logger.warn("oidc {} connection failed", operation, ex);
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.BAD_GATEWAY,
          "oidc " + operation + " connection failed",
          ex);
    } catch (OidcIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("oidc {} response parse failed", operation, ex);
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_RESPONSE,
          "oidc " + operation + " response parse failed",
          ex);
    }
  }

  private String withQuery(String endpoint, Map<String, String> params) {
    final StringBuilder url = new StringBuilder(endpoint);
    url.append(endpoint.contains("?") ? '&' : '?');
    url.append("client_id=").append(encode(clientId));
    params.forEach(
        (key, value) -> {
          if (value != null && !AuthorizationParameters.CLIENT_ID.equals(key)) {
            url.append('&').append(encode(key)).append('=').append(encode(value));
          }
        });
    return url.toString();
  }

  private String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String trimTrailingSlash(String value) {
    String result = value;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}

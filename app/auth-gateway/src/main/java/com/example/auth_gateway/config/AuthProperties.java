/*
 * どこで: Auth-Gateway 設定
 * 何を: secret/IdP/Cookie/ルーティング/セッションの設定値を保持する
 * なぜ: 環境ごとに切替可能にし、起動時に不正な設定を検出するため
 */
package com.example.auth_gateway.config;

import com.example.auth_gateway.http.CookieAttributes;
import com.example.auth_gateway.http.SameSite;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "auth")
@Validated
public record AuthProperties(
    @NotEmpty List<@NotBlank @Size(min = 8) String> secrets,
    @NotBlank String baseUrl,
    @NotBlank String clientId,
    String clientSecret,
    @NotBlank String issuerBaseUrl,
    Boolean legacySameSiteCookie,
    Boolean idpLogout,
    String organization,
    Map<String, String> authorizationParams,
    @Valid Routes routes,
    @Valid Cookie cookie,
    @Valid Session session,
    Duration httpTimeout) {

  public AuthProperties {
    secrets = secrets == null ? List.of() : List.copyOf(secrets);
    legacySameSiteCookie = legacySameSiteCookie == null ? Boolean.TRUE : legacySameSiteCookie;
    idpLogout = idpLogout == null ? Boolean.FALSE : idpLogout;
    organization = organization == null || organization.isBlank() ? null : organization;
    authorizationParams = authorizationParams == null ? Map.of() : Map.copyOf(authorizationParams);
    routes = routes == null ? new Routes(null, null, null, null) : routes;
    cookie = cookie == null ? new Cookie(null, null, null, null) : cookie;
    if (cookie.secure() == null) {
      // secure 未指定時は baseUrl が https かどうかで決める。
      cookie =
          new Cookie(
              cookie.domain(),
              cookie.path(),
              baseUrl != null && baseUrl.startsWith("https:"),
              cookie.sameSite());
    }
    session = session == null ? new Session(null, null) : session;
    httpTimeout = httpTimeout == null ? Duration.ofSeconds(5) : httpTimeout;
  }

  @AssertTrue(message = "auth.base-url must be an absolute http(s) URL")
  public boolean isBaseUrlAbsolute() {
    return isAbsoluteHttpUrl(baseUrl);
  }

  @AssertTrue(message = "auth.issuer-base-url must be an absolute http(s) URL")
  public boolean isIssuerBaseUrlAbsolute() {
    return isAbsoluteHttpUrl(issuerBaseUrl);
  }

  @AssertTrue(message = "auth.http-timeout must be positive")
  public boolean isHttpTimeoutPositive() {
    return httpTimeout != null && !httpTimeout.isZero() && !httpTimeout.isNegative();
  }

  /** Attributes shared by the transient and session cookies, before SameSite adjustments. */
  public CookieAttributes cookieAttributes() {
    return new CookieAttributes(
        true, cookie.secure(), cookie.domain(), cookie.path(), SameSite.from(cookie.sameSite()));
  }

  private static boolean isAbsoluteHttpUrl(String value) {
    if (value == null || value.isBlank()) {
      // 必須チェックは @NotBlank に任せる。
      return true;
    }
    try {
      final URI uri = new URI(value);
      return ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))
          && uri.getHost() != null;
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  public record Routes(String login, String callback, String logout, String postLogoutRedirect) {

    public Routes {
      login = login == null || login.isBlank() ? "/api/auth/login" : login;
      callback = callback == null || callback.isBlank() ? "/api/auth/callback" : callback;
      logout = logout == null || logout.isBlank() ? "/api/auth/logout" : logout;
      postLogoutRedirect = postLogoutRedirect == null ? "" : postLogoutRedirect;
    }
  }

  public record Cookie(String domain, String path, Boolean secure, String sameSite) {

    public Cookie {
      path = path == null || path.isBlank() ? "/" : path;
      sameSite = sameSite == null || sameSite.isBlank() ? "lax" : sameSite;
    }

    @AssertTrue(message = "auth.cookie.same-site must be one of lax, strict, none")
    public boolean isSameSiteSupported() {
      try {
        SameSite.from(sameSite);
        return true;
      } catch (IllegalArgumentException ex) {
        return false;
      }
    }
  }

  public record Session(String name, Duration ttl) {

    public Session {
      name = name == null || name.isBlank() ? "appSession" : name;
      ttl = ttl == null ? Duration.ofHours(1) : ttl;
    }

    @AssertTrue(message = "auth.session.ttl must be positive")
    public boolean isTtlPositive() {
      return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
  }
}

/*
 * どこで: Auth-Gateway Cookie 層
 * 何を: nonce/state/code_verifier などの一時値を署名付き Cookie として保存し、読み出し時に必ず削除する
 * なぜ: IdP への往復をまたいで値を改ざん不能な形で保持し、再利用を防ぐため
 */
package com.example.auth_gateway.cookie;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.http.AuthRequest;
import com.example.auth_gateway.http.AuthResponse;
import com.example.auth_gateway.http.CookieAttributes;
import com.example.auth_gateway.http.SameSite;
import com.example.common.crypto.SignedCookieCodec;
import com.example.common.crypto.SignedCookieDecodeResult;
import com.example.common.crypto.SigningKeyRing;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TransientStore {

  private static final Logger logger = LoggerFactory.getLogger(TransientStore.class);

  private final SigningKeyRing keyRing;
  private final CookieAttributes baseAttributes;
  private final boolean legacySameSiteCookie;

  public TransientStore(SigningKeyRing keyRing, AuthProperties properties) {
    this.keyRing = keyRing;
    this.baseAttributes = properties.cookieAttributes().withSameSite(null);
    this.legacySameSiteCookie = properties.legacySameSiteCookie();
  }

  /**
   * Signs and writes {@code options.value()} under {@code name}.
   *
   * @return the unsigned value
   */
  public String save(String name, AuthResponse response, TransientCookieOptions options) {
    final boolean sameSiteNone = options.sameSite() == SameSite.NONE;
    final CookieAttributes attributes =
        baseAttributes
            .withSameSite(options.sameSite())
            .withSecure(sameSiteNone || baseAttributes.secure());
    response.setCookie(
        name, SignedCookieCodec.encode(name, options.value(), keyRing.primaryKey()), attributes);

    if (sameSiteNone && legacySameSiteCookie) {
      final String fallbackName = LegacySameSiteCookies.fallbackName(name);
      response.setCookie(
          fallbackName,
          SignedCookieCodec.encode(fallbackName, options.value(), keyRing.primaryKey()),
          baseAttributes);
    }
    return options.value();
  }

  /**
   * Reads and clears the transient cookie. Missing, tampered and malformed cookies all read as
   * empty.
   */
  public Optional<String> read(String name, AuthRequest request, AuthResponse response) {
    final Map<String, String> cookies = request.getCookies();
    Optional<String> value = verify(name, cookies.get(name));
    response.clearCookie(name, baseAttributes);

    if (legacySameSiteCookie) {
      final String fallbackName = LegacySameSiteCookies.fallbackName(name);
      if (value.isEmpty()) {
        value = verify(fallbackName, cookies.get(fallbackName));
      }
      response.clearCookie(fallbackName, baseAttributes);
    }
    return value;
  }

  private Optional<String> verify(String name, String cookieValue) {
    if (cookieValue == null) {
      return Optional.empty();
    }
    final SignedCookieDecodeResult result =
        SignedCookieCodec.decode(name, cookieValue, keyRing.keys());
    if (!result.isValid()) {
      logger.debug("transient cookie rejected name={} outcome={}", name, result.outcome());
    }
    return result.asOptional();
  }
}

package com.example.auth_gateway.service;

import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.text.ParseException;
import org.springframework.stereotype.Component;

/**
 * Compares the {@code nonce} claim of an ID token with the nonce sent in the authorization
 * request. Only the claims are read; the token signature is not checked here.
 */
@Component
public class IdTokenNonceVerifier {

  public void verify(String idToken, String expectedNonce) {
    if (idToken == null || idToken.isBlank()) {
      throw new IllegalArgumentException("id_token is required");
    }
    if (expectedNonce == null || expectedNonce.isBlank()) {
      throw new IllegalArgumentException("expected nonce is required");
    }
    final Object nonce = readClaims(idToken).getClaim("nonce");
    if (!(nonce instanceof String value)
        || !MessageDigest.isEqual(
            value.getBytes(StandardCharsets.UTF_8),
            expectedNonce.getBytes(StandardCharsets.UTF_8))) {
      throw new ProtocolStateMissingException("id_token nonce mismatch");
    }
  }

  private JWTClaimsSet readClaims(String idToken) {
    final JWTClaimsSet claims;
    try {
      final JWT jwt = JWTParser.parse(idToken);
      claims = jwt.getJWTClaimsSet();
    } catch (ParseException ex) {
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_RESPONSE, "id_token is malformed", ex);
    }
    // 暗号化された ID トークンは復号しない。
    if (claims == null) {
      throw new OidcIntegrationException(
          OidcIntegrationException.Reason.INVALID_RESPONSE, "id_token claims are not readable");
    }
    return claims;
  }
}

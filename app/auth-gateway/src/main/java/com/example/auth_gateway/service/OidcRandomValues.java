package com.example.auth_gateway.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Nonce and PKCE material for authorization requests. */
@Component
@RequiredArgsConstructor
public class OidcRandomValues {

  public static final String CODE_CHALLENGE_METHOD = "S256";
  private static final int RANDOM_BYTES = 32;
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final SecureRandom secureRandom;

  public String nonce() {
    return random();
  }

  public String codeVerifier() {
    return random();
  }

  /** S256 transform: base64url(SHA-256(ASCII(verifier))). */
  public static String codeChallenge(String codeVerifier) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return ENCODER.encodeToString(digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  private String random() {
    final byte[] bytes = new byte[RANDOM_BYTES];
    secureRandom.nextBytes(bytes);
    return ENCODER.encodeToString(bytes);
  }
}

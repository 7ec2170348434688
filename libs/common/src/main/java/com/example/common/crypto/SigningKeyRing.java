package com.example.common.crypto;

import java.util.List;
import javax.crypto.SecretKey;

/**
 * Lazily derived signing keys for an ordered secret set.
 *
 * <p>The first secret is the primary one and signs new values; every key is tried when verifying
 * so that rotated secrets keep verifying until they are removed from the configuration. Keys are
 * derived on first use. Concurrent first calls may derive twice, which is harmless because the
 * derivation is deterministic.
 */
public final class SigningKeyRing {

  private final List<String> secrets;
  private final String purpose;
  private volatile List<SecretKey> keys;

  public SigningKeyRing(List<String> secrets, String purpose) {
    if (secrets == null || secrets.isEmpty()) {
      throw new IllegalArgumentException("at least one secret is required");
    }
    for (String secret : secrets) {
      if (secret == null || secret.isBlank()) {
        throw new IllegalArgumentException("secrets must not be blank");
      }
    }
    if (purpose == null || purpose.isBlank()) {
      throw new IllegalArgumentException("purpose is required");
    }
    this.secrets = List.copyOf(secrets);
    this.purpose = purpose;
  }

  public static SigningKeyRing forCookieSigning(List<String> secrets) {
    return new SigningKeyRing(secrets, SigningKeyDeriver.COOKIE_SIGNING_PURPOSE);
  }

  /** Verification keys in configured order. */
  public List<SecretKey> keys() {
    List<SecretKey> current = keys;
    if (current == null) {
      current = SigningKeyDeriver.derive(secrets, purpose);
      keys = current;
    }
    return current;
  }

  public SecretKey primaryKey() {
    return keys().get(0);
  }

  public String purpose() {
    return purpose;
  }
}

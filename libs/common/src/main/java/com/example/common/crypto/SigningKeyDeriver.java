/*
 * どこで: Common 暗号ユーティリティ
 * 何を: アプリケーション secret から用途別の HMAC 署名鍵を HKDF-SHA256 で導出する
 * なぜ: 同じ (secret, purpose) から常に同じ鍵を得て、状態を持たずに署名検証できるようにするため
 */
package com.example.common.crypto;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

public final class SigningKeyDeriver {

  /** HKDF info label for keys that sign cookie values. */
  public static final String COOKIE_SIGNING_PURPOSE = "JWS Cookie Signing";

  static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final int KEY_LENGTH = 32;
  private static final byte[] EMPTY_SALT = new byte[0];

  private SigningKeyDeriver() {}

  public static SecretKey deriveKey(String secret, String purpose) {
    if (secret == null || secret.isBlank()) {
      throw new IllegalArgumentException("secret is required");
    }
    if (purpose == null || purpose.isBlank()) {
      throw new IllegalArgumentException("purpose is required");
    }
    final HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
    generator.init(
        new HKDFParameters(
            secret.getBytes(StandardCharsets.UTF_8),
            EMPTY_SALT,
            purpose.getBytes(StandardCharsets.UTF_8)));
    final byte[] keyBytes = new byte[KEY_LENGTH];
    generator.generateBytes(keyBytes, 0, KEY_LENGTH);
    return new SecretKeySpec(keyBytes, HMAC_ALGORITHM);
  }

  /** Derives one key per secret, index 0 being the key of the primary secret. */
  public static List<SecretKey> derive(List<String> secrets, String purpose) {
    final List<SecretKey> keys = new ArrayList<>(secrets.size());
    for (String secret : secrets) {
      keys.add(deriveKey(secret, purpose));
    }
    return List.copyOf(keys);
  }
}

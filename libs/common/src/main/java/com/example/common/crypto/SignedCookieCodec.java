/*
 * どこで: Common 暗号ユーティリティ
 * 何を: Cookie 値へ HMAC-SHA256 署名を付与し、受信値を検証して元の値を取り出す
 * なぜ: Cookie 名と値の改ざん・すり替えを検出するため
 */
package com.example.common.crypto;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.List;
import javax.crypto.Mac;
import javax.crypto.SecretKey;

/**
 * Signed cookie values have the form {@code payload + "." + base64url(tag)} where the tag is
 * HMAC-SHA256 over {@code name + "=" + payload}. The separator is the last dot of the value.
 */
public final class SignedCookieCodec {

  private static final char SEPARATOR = '.';
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private SignedCookieCodec() {}

  public static String encode(String name, String payload, SecretKey key) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("cookie name is required");
    }
    if (payload == null) {
      throw new IllegalArgumentException("payload is required");
    }
    return payload + SEPARATOR + ENCODER.encodeToString(sign(name, payload, key));
  }

  /** Verifies with each key in order; the first matching key wins. */
  public static SignedCookieDecodeResult decode(
      String name, String cookieValue, List<SecretKey> keys) {
    if (name == null || cookieValue == null || cookieValue.isEmpty()) {
      return SignedCookieDecodeResult.malformed();
    }
    final int separatorIndex = cookieValue.lastIndexOf(SEPARATOR);
    if (separatorIndex < 0 || separatorIndex == cookieValue.length() - 1) {
      return SignedCookieDecodeResult.malformed();
    }
    final String payload = cookieValue.substring(0, separatorIndex);
    final byte[] receivedTag;
    try {
      receivedTag = DECODER.decode(cookieValue.substring(separatorIndex + 1));
    } catch (IllegalArgumentException ex) {
      return SignedCookieDecodeResult.malformed();
    }
    for (SecretKey key : keys) {
      if (MessageDigest.isEqual(sign(name, payload, key), receivedTag)) {
        return SignedCookieDecodeResult.valid(payload);
      }
    }
    return SignedCookieDecodeResult.invalidSignature();
  }

  private static byte[] sign(String name, String payload, SecretKey key) {
    try {
      final Mac mac = Mac.getInstance(SigningKeyDeriver.HMAC_ALGORITHM);
      mac.init(key);
      return mac.doFinal((name + "=" + payload).getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      throw new IllegalStateException("cookie signing failed", ex);
    }
  }
}

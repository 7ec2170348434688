package com.example.common.crypto;

import java.util.Optional;

public record SignedCookieDecodeResult(Outcome outcome, String payload) {

  public enum Outcome {
    VALID,
    INVALID_SIGNATURE,
    MALFORMED
  }

  public static SignedCookieDecodeResult valid(String payload) {
    return new SignedCookieDecodeResult(Outcome.VALID, payload);
  }

  public static SignedCookieDecodeResult invalidSignature() {
    return new SignedCookieDecodeResult(Outcome.INVALID_SIGNATURE, null);
  }

  public static SignedCookieDecodeResult malformed() {
    return new SignedCookieDecodeResult(Outcome.MALFORMED, null);
  }

  public boolean isValid() {
    return outcome == Outcome.VALID;
  }

  public Optional<String> asOptional() {
    return isValid() ? Optional.of(payload) : Optional.empty();
  }
}

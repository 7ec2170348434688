package com.example.auth_gateway.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class OidcRandomValuesTest {

  private final OidcRandomValues randomValues = new OidcRandomValues(new SecureRandom());

  @Test
  void codeChallengeFollowsS256() {
    // RFC 7636 Appendix B
    assertThat(OidcRandomValues.codeChallenge("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk"))
        .isEqualTo("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM");
  }

  @Test
  void randomValuesAreUnpaddedBase64UrlOf32Bytes() {
    final String nonce = randomValues.nonce();
    final String verifier = randomValues.codeVerifier();

    assertThat(nonce).hasSize(43).matches("[A-Za-z0-9_-]+");
    assertThat(verifier).hasSize(43).matches("[A-Za-z0-9_-]+");
    assertThat(nonce).isNotEqualTo(verifier);
    assertThat(randomValues.nonce()).isNotEqualTo(nonce);
  }
}

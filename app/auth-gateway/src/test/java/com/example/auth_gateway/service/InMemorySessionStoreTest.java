package com.example.auth_gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.auth_gateway.config.TestAuthProperties;
import com.example.auth_gateway.http.FakeAuthRequest;
import com.example.auth_gateway.http.RecordingAuthResponse;
import com.example.auth_gateway.model.TokenSet;
import com.example.common.crypto.SigningKeyRing;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private static final TokenSet TOKENS =
      new TokenSet("id-token", "access-token", null, "Bearer", 300L, "openid");

  private final Clock clock = mock(Clock.class);
  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    when(clock.instant()).thenReturn(NOW);
    store =
        new InMemorySessionStore(
            clock,
            SigningKeyRing.forCookieSigning(List.of(TestAuthProperties.SECRET)),
            TestAuthProperties.builder().sessionTtl(Duration.ofMinutes(30)).build());
  }

  @Test
  void createdSessionIsFoundThroughSignedCookie() {
    final RecordingAuthResponse created = new RecordingAuthResponse();
    store.create(new FakeAuthRequest(), created, TOKENS);

    final FakeAuthRequest next = new FakeAuthRequest().cookiesFrom(created);

    assertThat(created.setCookie("appSession")).isPresent();
    assertThat(store.isAuthenticated(next, new RecordingAuthResponse())).isTrue();
    assertThat(store.getIdToken(next, new RecordingAuthResponse())).contains("id-token");
  }

  @Test
  void deleteClearsCookieAndForgetsSession() {
    final RecordingAuthResponse created = new RecordingAuthResponse();
    store.create(new FakeAuthRequest(), created, TOKENS);
    final FakeAuthRequest next = new FakeAuthRequest().cookiesFrom(created);
    final RecordingAuthResponse deleted = new RecordingAuthResponse();

    store.delete(next, deleted);

    assertThat(deleted.clearedCookieNames()).containsExactly("appSession");
    assertThat(store.isAuthenticated(next, new RecordingAuthResponse())).isFalse();
  }

  @Test
  void sessionExpiresAfterTtl() {
    final RecordingAuthResponse created = new RecordingAuthResponse();
    store.create(new FakeAuthRequest(), created, TOKENS);
    final FakeAuthRequest next = new FakeAuthRequest().cookiesFrom(created);

    when(clock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(31)));

    assertThat(store.isAuthenticated(next, new RecordingAuthResponse())).isFalse();
    assertThat(store.getIdToken(next, new RecordingAuthResponse())).isEmpty();
  }

  @Test
  void forgedSessionCookieIsNotAuthenticated() {
    final FakeAuthRequest forged = new FakeAuthRequest().cookie("appSession", "session-id.AAAA");

    assertThat(store.isAuthenticated(forged, new RecordingAuthResponse())).isFalse();
  }

  @Test
  void createReplacesPreviousSession() {
    final RecordingAuthResponse first = new RecordingAuthResponse();
    store.create(new FakeAuthRequest(), first, TOKENS);
    final FakeAuthRequest firstRequest = new FakeAuthRequest().cookiesFrom(first);

    final RecordingAuthResponse second = new RecordingAuthResponse();
    store.create(firstRequest, second, TOKENS);

    assertThat(store.isAuthenticated(firstRequest, new RecordingAuthResponse())).isFalse();
    assertThat(
            store.isAuthenticated(
                new FakeAuthRequest().cookiesFrom(second), new RecordingAuthResponse()))
        .isTrue();
  }

  @Test
  void createRequiresTokenSet() {
    assertThatThrownBy(
            () -> store.create(new FakeAuthRequest(), new RecordingAuthResponse(), null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("tokenSet is required");
  }
}

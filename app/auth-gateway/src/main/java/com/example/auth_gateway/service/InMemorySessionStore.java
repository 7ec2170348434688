package com.example.auth_gateway.service;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.http.AuthRequest;
import com.example.auth_gateway.http.AuthResponse;
import com.example.auth_gateway.http.CookieAttributes;
import com.example.auth_gateway.model.TokenSet;
import com.example.common.crypto.SignedCookieCodec;
import com.example.common.crypto.SigningKeyRing;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/** Server-side sessions referenced by a signed session id cookie. */
@Service
public class InMemorySessionStore implements SessionStore {

  private final Clock clock;
  private final SigningKeyRing keyRing;
  private final String cookieName;
  private final Duration ttl;
  private final CookieAttributes cookieAttributes;
  private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

  public InMemorySessionStore(Clock clock, SigningKeyRing keyRing, AuthProperties properties) {
    this.clock = clock;
    this.keyRing = keyRing;
    this.cookieName = properties.session().name();
    this.ttl = properties.session().ttl();
    this.cookieAttributes = properties.cookieAttributes();
  }

  @Override
  public boolean isAuthenticated(AuthRequest request, AuthResponse response) {
    return find(request).isPresent();
  }

  @Override
  public Optional<String> getIdToken(AuthRequest request, AuthResponse response) {
    return find(request).map(entry -> entry.tokenSet().idToken());
  }

  @Override
  public void create(AuthRequest request, AuthResponse response, TokenSet tokenSet) {
    if (tokenSet == null) {
      throw new IllegalArgumentException("tokenSet is required");
    }
    sessionId(request).ifPresent(sessions::remove);
    final String sessionId = UUID.randomUUID().toString();
    sessions.put(sessionId, new SessionEntry(tokenSet, Instant.now(clock).plus(ttl)));
    response.setCookie(
        cookieName,
        SignedCookieCodec.encode(cookieName, sessionId, keyRing.primaryKey()),
        cookieAttributes);
  }

  @Override
  public void delete(AuthRequest request, AuthResponse response) {
    sessionId(request).ifPresent(sessions::remove);
    response.clearCookie(cookieName, cookieAttributes);
  }

  private Optional<SessionEntry> find(AuthRequest request) {
    final Optional<String> sessionId = sessionId(request);
    if (sessionId.isEmpty()) {
      return Optional.empty();
    }
    final SessionEntry entry = sessions.get(sessionId.get());
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.expiresAt().isBefore(Instant.now(clock))) {
      sessions.remove(sessionId.get());
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  private Optional<String> sessionId(AuthRequest request) {
    final String cookieValue = request.getCookies().get(cookieName);
    if (cookieValue == null) {
      return Optional.empty();
    }
    return SignedCookieCodec.decode(cookieName, cookieValue, keyRing.keys()).asOptional();
  }

  private record SessionEntry(TokenSet tokenSet, Instant expiresAt) {}
}

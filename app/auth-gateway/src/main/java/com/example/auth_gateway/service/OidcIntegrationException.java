package com.example.auth_gateway.service;

public class OidcIntegrationException extends RuntimeException {

  public enum Reason {
    REJECTED,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public OidcIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public OidcIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}

package com.example.auth_gateway.service;

/** Failure of a login, callback or logout attempt before its redirect could be issued. */
public class AuthHandlerException extends RuntimeException {

  public enum Phase {
    LOGIN("Login"),
    CALLBACK("Callback"),
    LOGOUT("Logout");

    private final String label;

    Phase(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  private final Phase phase;

  public AuthHandlerException(Phase phase, Throwable cause) {
    super(phase.label() + " handler failed. CAUSE: " + cause.getMessage(), cause);
    this.phase = phase;
  }

  public Phase phase() {
    return phase;
  }
}

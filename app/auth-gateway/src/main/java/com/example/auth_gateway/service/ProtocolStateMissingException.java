package com.example.auth_gateway.service;

/**
 * The transient state of a login round trip is missing, expired or does not match. The login
 * cannot be completed and has to be started again.
 */
public class ProtocolStateMissingException extends RuntimeException {

  public ProtocolStateMissingException(String message) {
    super(message);
  }
}

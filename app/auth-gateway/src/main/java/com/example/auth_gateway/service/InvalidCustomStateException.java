package com.example.auth_gateway.service;

public class InvalidCustomStateException extends RuntimeException {

  public InvalidCustomStateException(String message) {
    super(message);
  }

  public InvalidCustomStateException(String message, Throwable cause) {
    super(message, cause);
  }
}

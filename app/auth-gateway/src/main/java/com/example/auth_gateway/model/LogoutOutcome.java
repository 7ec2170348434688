package com.example.auth_gateway.model;

public enum LogoutOutcome {
  ALREADY_LOGGED_OUT,
  LOCAL,
  IDENTITY_PROVIDER
}

package com.example.auth_gateway.http;

import java.util.Locale;

public enum SameSite {
  LAX("Lax"),
  STRICT("Strict"),
  NONE("None");

  private final String attributeValue;

  SameSite(String attributeValue) {
    this.attributeValue = attributeValue;
  }

  public String attributeValue() {
    return attributeValue;
  }

  public static SameSite from(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("sameSite is required");
    }
    return SameSite.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

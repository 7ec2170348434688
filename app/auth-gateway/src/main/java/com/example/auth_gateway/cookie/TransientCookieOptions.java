package com.example.auth_gateway.cookie;

import com.example.auth_gateway.http.SameSite;

public record TransientCookieOptions(String value, SameSite sameSite) {

  public TransientCookieOptions {
    if (value == null) {
      throw new IllegalArgumentException("value is required");
    }
    sameSite = sameSite == null ? SameSite.NONE : sameSite;
  }

  public static TransientCookieOptions of(String value, SameSite sameSite) {
    return new TransientCookieOptions(value, sameSite);
  }
}

package com.example.auth_gateway.cookie;

/**
 * Naming of the fallback cookies written for browsers that reject {@code SameSite=None}. The
 * fallback carries the same value under the name prefixed with an underscore and without the
 * SameSite attribute.
 */
public final class LegacySameSiteCookies {

  private static final String FALLBACK_PREFIX = "_";

  private LegacySameSiteCookies() {}

  public static String fallbackName(String name) {
    return FALLBACK_PREFIX + name;
  }
}

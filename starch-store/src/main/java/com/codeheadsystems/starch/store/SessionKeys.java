package com.codeheadsystems.starch.store;

/**
 * Argument checks shared by {@link SessionStore} implementations.
 */
public final class SessionKeys {

  private SessionKeys() {
  }

  /**
   * Rejects null or empty keys.
   *
   * @param key the session key
   * @return the key
   */
  public static String requireKey(String key) {
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("Session key must not be empty");
    }
    return key;
  }

  /**
   * Rejects negative time-to-live values.
   *
   * @param ttlSeconds the time-to-live in seconds
   * @return the time-to-live
   */
  public static long requireTtl(long ttlSeconds) {
    if (ttlSeconds < 0) {
      throw new IllegalArgumentException("ttlSeconds must not be negative: " + ttlSeconds);
    }
    return ttlSeconds;
  }

  /**
   * Absolute expiration for a time-to-live, saturating at {@link Long#MAX_VALUE} instead of
   * wrapping when the sum does not fit.
   *
   * @param now        the current time in epoch seconds
   * @param ttlSeconds the non-negative time-to-live in seconds
   * @return the expiration in epoch seconds
   */
  public static long expiration(long now, long ttlSeconds) {
    return ttlSeconds > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlSeconds;
  }
}

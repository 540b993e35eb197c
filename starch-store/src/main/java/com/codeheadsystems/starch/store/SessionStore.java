package com.codeheadsystems.starch.store;

import java.util.Map;
import java.util.Optional;

/**
 * Storage abstraction for session payloads keyed by a session identifier.
 * <p>
 * The host session framework owns key generation and the session lifecycle; a store only
 * persists the payload, honors its expiration and removes it on demand.
 * <p>
 * Implementations must be thread-safe. A payload whose expiration has passed must never be
 * returned, whether or not it has been physically removed yet.
 */
public interface SessionStore {

  /**
   * Stores or replaces the payload for the given key.
   *
   * @param key        non-empty session identifier
   * @param value      the session payload
   * @param ttlSeconds seconds from now until the payload expires, zero or more
   */
  void set(String key, Map<String, Object> value, long ttlSeconds);

  /**
   * Loads the payload for the given key.
   *
   * @param key session identifier
   * @return the payload, or empty if not found or expired
   */
  Optional<Map<String, Object>> get(String key);

  /**
   * Removes the payload for the given key. Removing an unknown key is not an error.
   *
   * @param key session identifier
   */
  void remove(String key);
}

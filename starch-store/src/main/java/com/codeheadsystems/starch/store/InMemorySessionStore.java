package com.codeheadsystems.starch.store;

import com.codeheadsystems.starch.serializer.Serializer;
import com.codeheadsystems.starch.serializer.Serializers;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Payloads are kept in serialized form so callers never share mutable state with the store.
 * Expired sessions are lazily evicted on {@link #get}. All sessions are lost on restart.
 * Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private record Entry(byte[] data, long expiration) {
  }

  private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();
  private final Serializer serializer;
  private final Clock clock;

  /**
   * Creates a store using the JSON serializer and the system clock.
   */
  public InMemorySessionStore() {
    this(Serializers.json(), Clock.systemUTC());
  }

  /**
   * Creates a store.
   *
   * @param serializer codec applied to every payload
   * @param clock      source of the current time
   */
  public InMemorySessionStore(Serializer serializer, Clock clock) {
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.clock = Objects.requireNonNull(clock, "clock");
    log.warn("Using InMemorySessionStore; sessions will NOT survive restarts. "
        + "Replace with a persistent SessionStore for production.");
  }

  @Override
  public void set(String key, Map<String, Object> value, long ttlSeconds) {
    SessionKeys.requireKey(key);
    SessionKeys.requireTtl(ttlSeconds);
    long now = clock.instant().getEpochSecond();
    byte[] data = serializer.serialize(Objects.requireNonNull(value, "value"));
    store.put(key, new Entry(data, SessionKeys.expiration(now, ttlSeconds)));
    log.debug("Stored session key={}", key);
  }

  @Override
  public Optional<Map<String, Object>> get(String key) {
    SessionKeys.requireKey(key);
    Entry entry = store.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.expiration() <= clock.instant().getEpochSecond()) {
      store.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(serializer.deserialize(entry.data()));
  }

  @Override
  public void remove(String key) {
    SessionKeys.requireKey(key);
    store.remove(key);
    log.debug("Removed session key={}", key);
  }

  /**
   * Number of entries held, including expired ones not yet evicted.
   *
   * @return the entry count
   */
  public int size() {
    return store.size();
  }
}

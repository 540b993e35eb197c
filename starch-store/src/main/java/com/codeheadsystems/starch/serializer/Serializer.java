package com.codeheadsystems.starch.serializer;

import java.util.Map;

/**
 * Converts a session payload to a storable blob and back.
 * <p>
 * {@code deserialize(serialize(v))} must equal {@code v} for every payload built from the
 * JSON-native value domain: {@code String}, {@code Boolean}, {@code Double}, {@code List},
 * {@code Map} with string keys, {@code null}, and whole numbers as {@code Integer} when they
 * fit in an int, {@code Long} when they fit in a long, {@code BigInteger} otherwise. Other
 * numeric types are accepted but come back in that domain, so {@code 42L} reads back as
 * {@code Integer 42} and a {@code Float} as a {@code Double} (JSON). Failures in either direction are reported as
 * {@link com.codeheadsystems.starch.exceptions.SerializationException}.
 */
public interface Serializer {

  /**
   * Encodes the payload.
   *
   * @param value the session payload
   * @return the encoded blob
   */
  byte[] serialize(Map<String, Object> value);

  /**
   * Decodes a blob previously produced by {@link #serialize(Map)}.
   *
   * @param blob the stored blob
   * @return the session payload, never null
   */
  Map<String, Object> deserialize(byte[] blob);
}

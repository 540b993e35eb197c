package com.codeheadsystems.starch.serializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.fasterxml.jackson.dataformat.smile.databind.SmileMapper;
import java.util.Locale;

/**
 * Built-in codecs, each backed by a Jackson data format.
 */
public enum Codec {

  /**
   * UTF-8 JSON text. The default codec.
   */
  JSON {
    @Override
    ObjectMapper newObjectMapper() {
      return new ObjectMapper();
    }
  },
  /**
   * Binary CBOR (RFC 8949).
   */
  CBOR {
    @Override
    ObjectMapper newObjectMapper() {
      return new CBORMapper();
    }
  },
  /**
   * Binary Smile, Jackson's compact JSON-equivalent format.
   */
  SMILE {
    @Override
    ObjectMapper newObjectMapper() {
      return new SmileMapper();
    }
  };

  abstract ObjectMapper newObjectMapper();

  /**
   * Looks up a codec by name, ignoring case.
   *
   * @param name codec name such as {@code "JSON"} or {@code "cbor"}
   * @return the codec
   * @throws IllegalArgumentException if no codec has that name
   */
  public static Codec fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Codec name must not be empty");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown codec: " + name, e);
    }
  }
}

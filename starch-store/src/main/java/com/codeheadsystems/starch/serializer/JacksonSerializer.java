package com.codeheadsystems.starch.serializer;

import com.codeheadsystems.starch.exceptions.SerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;

/**
 * {@link Serializer} backed by a Jackson {@link ObjectMapper}.
 * <p>
 * Works with any Jackson data format; {@link Serializers} builds the JSON, CBOR and Smile
 * variants. Trailing content after the top-level object is treated as corruption.
 */
public class JacksonSerializer implements Serializer {

  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
  };

  private final String name;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Jackson serializer.
   *
   * @param name         codec name used in error messages
   * @param objectMapper the object mapper; a strict copy is used and the original is left as is
   */
  public JacksonSerializer(final String name, final ObjectMapper objectMapper) {
    this.name = name;
    this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Gets the codec name.
   *
   * @return the name
   */
  public String name() {
    return name;
  }

  @Override
  public byte[] serialize(final Map<String, Object> value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Unable to encode session payload as " + name, e);
    }
  }

  @Override
  public Map<String, Object> deserialize(final byte[] blob) {
    final Map<String, Object> value;
    try {
      value = objectMapper.readValue(blob, PAYLOAD_TYPE);
    } catch (IOException e) {
      throw new SerializationException("Unable to decode stored " + name + " session payload", e);
    }
    if (value == null) {
      throw new SerializationException("Stored " + name + " session payload decoded to null");
    }
    return value;
  }

  @Override
  public String toString() {
    return "JacksonSerializer(" + name + ")";
  }
}

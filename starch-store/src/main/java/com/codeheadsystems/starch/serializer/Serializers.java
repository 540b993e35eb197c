package com.codeheadsystems.starch.serializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Builds {@link Serializer} instances from a codec name or a {@link SerializerConfig}.
 */
public final class Serializers {

  private Serializers() {
  }

  /**
   * The default serializer, compact JSON.
   *
   * @return the serializer
   */
  public static Serializer json() {
    return fromConfig(SerializerConfig.DEFAULT);
  }

  /**
   * Builds the named codec with default options.
   *
   * @param codec codec name, case-insensitive
   * @return the serializer
   */
  public static Serializer fromName(String codec) {
    return fromConfig(SerializerConfig.of(codec));
  }

  /**
   * Builds the codec described by the config.
   *
   * @param config the serializer config
   * @return the serializer
   */
  public static Serializer fromConfig(SerializerConfig config) {
    Codec codec = Codec.fromName(config.codec());
    ObjectMapper objectMapper = codec.newObjectMapper();
    if (config.sortKeys()) {
      objectMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }
    if (config.pretty() && codec == Codec.JSON) {
      objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }
    return new JacksonSerializer(codec.name(), objectMapper);
  }
}

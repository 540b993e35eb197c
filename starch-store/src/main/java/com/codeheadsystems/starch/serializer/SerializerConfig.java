package com.codeheadsystems.starch.serializer;

/**
 * Describes a built-in serializer: the codec name plus its options.
 *
 * @param codec    codec name, see {@link Codec}
 * @param sortKeys write map entries ordered by key so equal payloads produce equal blobs
 * @param pretty   indent the output; only honored by the JSON codec
 */
public record SerializerConfig(String codec, boolean sortKeys, boolean pretty) {

  /**
   * Compact JSON with insertion-ordered keys.
   */
  public static final SerializerConfig DEFAULT = new SerializerConfig(Codec.JSON.name(), false, false);

  /**
   * Config for the named codec with default options.
   *
   * @param codec codec name
   * @return the serializer config
   */
  public static SerializerConfig of(String codec) {
    return new SerializerConfig(codec, false, false);
  }
}

package com.codeheadsystems.starch.exceptions;

/**
 * The type Serialization exception.
 */
public class SerializationException extends RuntimeException {
  /**
   * Instantiates a new Serialization exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SerializationException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Instantiates a new Serialization exception.
   *
   * @param message the message
   */
  public SerializationException(final String message) {
    super(message);
  }
}

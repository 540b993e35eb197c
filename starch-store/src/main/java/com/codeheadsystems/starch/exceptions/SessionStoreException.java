package com.codeheadsystems.starch.exceptions;

/**
 * The type Session store exception.
 * <p>
 * Thrown when the backing database rejects a statement. The original
 * {@link java.sql.SQLException} is always the cause.
 */
public class SessionStoreException extends RuntimeException {
  /**
   * Instantiates a new Session store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SessionStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

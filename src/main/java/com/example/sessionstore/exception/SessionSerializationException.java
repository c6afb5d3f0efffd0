package com.example.sessionstore.exception;

/**
 * Session payload could not be encoded or decoded
 */
public class SessionSerializationException extends RuntimeException {
  public SessionSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.example.sessionstore.exception;

/**
 * Session store failure surfaced to callers that prefer exceptions over results.
 */
public class SessionStoreException extends RuntimeException {
  public SessionStoreException(String message) {
    super(message);
  }

  public SessionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

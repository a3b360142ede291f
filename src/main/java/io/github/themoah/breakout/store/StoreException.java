package io.github.themoah.breakout.store;

/**
 * Raised when the store rejects or cannot serve a request.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

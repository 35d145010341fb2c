package com.codeheadsystems.tollgate.server.store;

/**
 * Thrown by {@link SessionStore} implementations when the backing store cannot be reached or does
 * not answer in time. Guards treat it as a rejection (fail closed).
 */
public class StoreUnavailableException extends RuntimeException {

  /**
   * Instantiates a new Store unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Instantiates a new Store unavailable exception.
   *
   * @param message the message
   */
  public StoreUnavailableException(String message) {
    super(message);
  }
}

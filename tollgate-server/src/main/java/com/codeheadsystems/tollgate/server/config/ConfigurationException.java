package com.codeheadsystems.tollgate.server.config;

/**
 * Thrown at construction time when required configuration is missing or invalid.
 * <p>
 * This is a startup failure; it is never raised while serving a request.
 */
public class ConfigurationException extends RuntimeException {

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   */
  public ConfigurationException(String message) {
    super(message);
  }
}

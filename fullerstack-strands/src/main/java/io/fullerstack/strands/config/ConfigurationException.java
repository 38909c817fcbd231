package io.fullerstack.strands.config;

/**
 * Thrown when a required configuration key is missing or holds a value
 * that cannot be converted to the requested type.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}

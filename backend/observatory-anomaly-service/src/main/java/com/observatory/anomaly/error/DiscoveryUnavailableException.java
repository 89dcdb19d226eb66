package com.observatory.anomaly.error;

/**
 * A container platform API could not be reached or answered with an error.
 */
public class DiscoveryUnavailableException extends RuntimeException {
  public DiscoveryUnavailableException(String message) {
    super(message);
  }

  public DiscoveryUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.observatory.anomaly.error;

/**
 * The metrics source could not be reached, timed out or answered with an error.
 */
public class SourceUnavailableException extends RuntimeException {
  public SourceUnavailableException(String message) {
    super(message);
  }

  public SourceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}

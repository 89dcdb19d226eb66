package com.observatory.anomaly.error;

public class PersistenceFailureException extends RuntimeException {
  public PersistenceFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}

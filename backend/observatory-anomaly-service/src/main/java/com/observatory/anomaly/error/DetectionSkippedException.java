package com.observatory.anomaly.error;

/**
 * Detection cannot run on the current window. The sample itself stays stored.
 */
public abstract class DetectionSkippedException extends RuntimeException {
  private final String serviceName;

  protected DetectionSkippedException(String serviceName, String message) {
    super(message);
    this.serviceName = serviceName;
  }

  public String getServiceName() { return serviceName; }

  public abstract String reason();
}

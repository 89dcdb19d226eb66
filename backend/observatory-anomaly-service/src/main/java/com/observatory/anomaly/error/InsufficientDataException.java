package com.observatory.anomaly.error;

public class InsufficientDataException extends DetectionSkippedException {
  private final int available;
  private final int required;

  public InsufficientDataException(String serviceName, int available, int required) {
    super(serviceName, "Only " + available + " samples for " + serviceName + ", need " + required);
    this.available = available;
    this.required = required;
  }

  public int getAvailable() { return available; }
  public int getRequired() { return required; }

  @Override
  public String reason() {
    return "insufficient_data";
  }
}

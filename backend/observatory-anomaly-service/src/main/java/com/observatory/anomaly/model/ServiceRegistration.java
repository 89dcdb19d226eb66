package com.observatory.anomaly.model;

import java.time.Instant;

public record ServiceRegistration(
    String serviceName,
    String serviceType,
    String status,
    Instant firstSeen,
    Instant lastSeen
) {
  public static final String ACTIVE = "active";
  public static final String PAUSED = "paused";
  public static final String UNKNOWN_TYPE = "unknown";

  public boolean isActive() {
    return ACTIVE.equals(status);
  }
}

package com.observatory.anomaly.model;

import java.util.Locale;

public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  WARNING,
  CRITICAL,
  UNKNOWN;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static HealthStatus fromScore(int score) {
    if (score >= 90) return HEALTHY;
    if (score >= 70) return DEGRADED;
    if (score >= 50) return WARNING;
    return CRITICAL;
  }
}

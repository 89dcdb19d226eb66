package com.observatory.anomaly.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record AnomalyRecord(
    Long id,
    String serviceName,
    Instant timestamp,
    String anomalyType,
    Severity severity,
    double anomalyScore,
    List<String> affectedMetrics,
    String description,
    Instant detectedAt
) {
  public static final String METRIC_DEVIATION = "metric_deviation";

  public AnomalyRecord {
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(severity, "severity");
    if (anomalyScore < 0.0 || anomalyScore > 1.0) {
      throw new IllegalArgumentException("anomalyScore must be within [0,1]: " + anomalyScore);
    }
    affectedMetrics = affectedMetrics == null ? List.of() : List.copyOf(affectedMetrics);
    anomalyType = anomalyType == null ? METRIC_DEVIATION : anomalyType;
  }
}

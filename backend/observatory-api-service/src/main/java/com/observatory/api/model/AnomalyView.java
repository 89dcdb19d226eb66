package com.observatory.api.model;

import com.observatory.anomaly.model.AnomalyRecord;

import java.time.Instant;
import java.util.List;

public record AnomalyView(
    Long id,
    String serviceName,
    Instant timestamp,
    String anomalyType,
    String severity,
    double anomalyScore,
    List<String> affectedMetrics,
    String description,
    Instant detectedAt
) {
  public static AnomalyView of(AnomalyRecord a) {
    return new AnomalyView(a.id(), a.serviceName(), a.timestamp(), a.anomalyType(), a.severity().label(),
        a.anomalyScore(), a.affectedMetrics(), a.description(), a.detectedAt());
  }
}

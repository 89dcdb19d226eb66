package com.observatory.anomaly.model;

import com.observatory.anomaly.health.HealthAssessment;

/**
 * Outcome of one per-service collection. {@code detail} carries the failure message or the
 * reason detection was skipped.
 */
public record CollectionResult(
    String serviceName,
    Outcome outcome,
    MetricSample sample,
    AnomalyRecord anomaly,
    HealthAssessment health,
    String detail
) {
  public enum Outcome { STORED, DUPLICATE, NO_DATA, FAILED }

  public static CollectionResult stored(MetricSample sample, AnomalyRecord anomaly, HealthAssessment health, String detail) {
    return new CollectionResult(sample.serviceName(), Outcome.STORED, sample, anomaly, health, detail);
  }

  public static CollectionResult duplicate(MetricSample sample) {
    return new CollectionResult(sample.serviceName(), Outcome.DUPLICATE, sample, null, null, "sample already stored");
  }

  public static CollectionResult noData(String serviceName) {
    return new CollectionResult(serviceName, Outcome.NO_DATA, null, null, null, "source returned no data");
  }

  public static CollectionResult failed(String serviceName, String detail) {
    return new CollectionResult(serviceName, Outcome.FAILED, null, null, null, detail);
  }

  public boolean anomalyDetected() {
    return anomaly != null;
  }
}

package com.observatory.anomaly.detect;

import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.Severity;

import java.time.Instant;
import java.util.List;

/**
 * Fused result for the current vector of one window. {@code severity} is null below the lowest threshold.
 */
public record EnsembleVerdict(
    String serviceName,
    Instant timestamp,
    DetectorScore empiricalTail,
    DetectorScore isolation,
    double fusedScore,
    Severity severity,
    List<TailProbability> attributed,
    String description
) {
  public EnsembleVerdict {
    attributed = List.copyOf(attributed);
  }

  public boolean isAnomalous() {
    return severity != null;
  }

  public List<String> affectedMetrics() {
    return attributed.stream().map(t -> t.feature().metricName()).toList();
  }

  public AnomalyRecord toRecord(Instant detectedAt) {
    if (!isAnomalous()) {
      throw new IllegalStateException("Score " + fusedScore + " is below every severity threshold");
    }
    return new AnomalyRecord(null, serviceName, timestamp, AnomalyRecord.METRIC_DEVIATION, severity,
        fusedScore, affectedMetrics(), description, detectedAt);
  }
}

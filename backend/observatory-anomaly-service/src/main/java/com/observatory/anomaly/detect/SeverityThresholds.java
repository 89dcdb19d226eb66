package com.observatory.anomaly.detect;

import com.observatory.anomaly.model.Severity;

import java.util.Optional;

/**
 * Inclusive lower bounds of the fused score per severity.
 */
public record SeverityThresholds(Double critical, Double high, Double medium, Double low) {

  public static final SeverityThresholds DEFAULTS = new SeverityThresholds(0.95, 0.85, 0.70, 0.50);

  public SeverityThresholds {
    critical = critical == null ? 0.95 : critical;
    high = high == null ? 0.85 : high;
    medium = medium == null ? 0.70 : medium;
    low = low == null ? 0.50 : low;
    if (low <= 0.0 || critical > 1.0) {
      throw new IllegalArgumentException("Severity thresholds must lie in (0,1]");
    }
    if (!(critical > high && high > medium && medium > low)) {
      throw new IllegalArgumentException(
          "Severity thresholds must be strictly descending: critical=" + critical
              + " high=" + high + " medium=" + medium + " low=" + low);
    }
  }

  public Optional<Severity> classify(double score) {
    if (score >= critical) return Optional.of(Severity.CRITICAL);
    if (score >= high) return Optional.of(Severity.HIGH);
    if (score >= medium) return Optional.of(Severity.MEDIUM);
    if (score >= low) return Optional.of(Severity.LOW);
    return Optional.empty();
  }
}

package com.observatory.anomaly.detect;

/**
 * @param raw        detector-specific score before normalization
 * @param normalized score in [0,1], higher is more anomalous
 */
public record DetectorScore(DetectorKind kind, double raw, double normalized) {
  public DetectorScore {
    if (normalized < 0.0 || normalized > 1.0 || Double.isNaN(normalized)) {
      throw new IllegalArgumentException(kind + " score outside [0,1]: " + normalized);
    }
  }
}

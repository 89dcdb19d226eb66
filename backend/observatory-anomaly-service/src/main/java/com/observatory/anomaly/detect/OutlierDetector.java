package com.observatory.anomaly.detect;

/**
 * Scores the newest vector of a window against the rest of it. Implementations keep no state
 * between calls.
 */
public interface OutlierDetector {

  DetectorKind kind();

  DetectorScore score(FeatureMatrix window);
}

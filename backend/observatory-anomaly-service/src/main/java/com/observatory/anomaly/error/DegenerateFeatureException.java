package com.observatory.anomaly.error;

import com.observatory.anomaly.model.Feature;

public class DegenerateFeatureException extends DetectionSkippedException {
  private final Feature feature;

  public DegenerateFeatureException(String serviceName, Feature feature) {
    super(serviceName, "Feature " + feature.metricName() + " has zero variance for " + serviceName);
    this.feature = feature;
  }

  public Feature getFeature() { return feature; }

  @Override
  public String reason() {
    return "degenerate_feature";
  }
}

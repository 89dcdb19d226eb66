package com.observatory.anomaly.detect;

import com.observatory.anomaly.Fixtures;
import com.observatory.anomaly.model.MetricSample;

import java.util.ArrayList;
import java.util.List;

final class WindowFixtures {

  private WindowFixtures() {}

  /** 24 steady hours followed by a typical 25th. */
  static FeatureMatrix typical() {
    return new FeatureExtractor(null, null, 10, 1440, null)
        .extract("checkout", Fixtures.steadySeries("checkout", 25));
  }

  /** 24 steady hours followed by an error-rate spike to 45%. */
  static FeatureMatrix errorSpike() {
    List<MetricSample> samples = new ArrayList<>(Fixtures.steadySeries("checkout", 24));
    samples.add(Fixtures.withErrorRate("checkout", 24, 0.45));
    return new FeatureExtractor(null, null, 10, 1440, null).extract("checkout", samples);
  }
}

package com.observatory.anomaly.detect;

import com.observatory.anomaly.error.DegenerateFeatureException;
import com.observatory.anomaly.error.InsufficientDataException;
import com.observatory.anomaly.model.Feature;
import com.observatory.anomaly.model.MetricSample;
import com.observatory.anomaly.store.MetricStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the recent samples of a service into the feature window the detectors score.
 */
public class FeatureExtractor {

  private final MetricStore store;
  private final Clock clock;
  private final int minWindowSize;
  private final int maxWindowSize;
  private final Duration lookback;

  public FeatureExtractor(MetricStore store, Clock clock, int minWindowSize, int maxWindowSize, Duration lookback) {
    this.store = store;
    this.clock = clock;
    this.minWindowSize = minWindowSize;
    this.maxWindowSize = maxWindowSize;
    this.lookback = lookback;
  }

  public FeatureMatrix extract(String serviceName) {
    Instant since = clock.instant().minus(lookback);
    return extract(serviceName, store.recentWindow(serviceName, since, maxWindowSize));
  }

  public FeatureMatrix extract(String serviceName, List<MetricSample> samples) {
    if (samples.size() < minWindowSize) {
      throw new InsufficientDataException(serviceName, samples.size(), minWindowSize);
    }
    List<MetricSample> ordered = new ArrayList<>(samples);
    ordered.sort(Comparator.comparing(MetricSample::timestamp));

    double[][] rows = new double[ordered.size()][];
    List<Instant> timestamps = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      rows[i] = toVector(ordered.get(i));
      timestamps.add(ordered.get(i).timestamp());
    }

    for (Feature feature : Feature.VECTOR) {
      int d = feature.ordinal();
      double min = rows[0][d];
      double max = rows[0][d];
      for (double[] row : rows) {
        min = Math.min(min, row[d]);
        max = Math.max(max, row[d]);
      }
      if (min == max) {
        throw new DegenerateFeatureException(serviceName, feature);
      }
    }
    return new FeatureMatrix(serviceName, timestamps, rows);
  }

  public static double[] toVector(MetricSample sample) {
    double[] vector = new double[Feature.VECTOR.size()];
    for (Feature feature : Feature.VECTOR) {
      vector[feature.ordinal()] = feature.extract(sample);
    }
    return vector;
  }
}

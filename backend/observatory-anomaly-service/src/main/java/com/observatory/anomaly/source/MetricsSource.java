package com.observatory.anomaly.source;

import com.observatory.anomaly.model.MetricSample;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Where samples come from. Implementations throw
 * {@link com.observatory.anomaly.error.SourceUnavailableException} when the backend cannot answer.
 */
public interface MetricsSource {

  /** Current values for one service, empty when the source knows nothing about it. */
  Optional<MetricSample> fetchSample(String serviceName, Instant timestamp);

  /** Samples between {@code start} and {@code end}, oldest first. */
  List<MetricSample> fetchHistory(String serviceName, Instant start, Instant end, Duration step);
}

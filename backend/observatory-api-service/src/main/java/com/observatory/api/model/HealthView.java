package com.observatory.api.model;

import com.observatory.anomaly.model.MetricSample;
import com.observatory.anomaly.model.ServiceHealth;

import java.time.Instant;
import java.util.List;

/**
 * Health of one service with the metrics of its latest sample; metric fields are null when the
 * service has never been sampled.
 */
public record HealthView(
    String serviceName,
    Integer healthScore,
    String status,
    List<String> factors,
    String activeAnomaly,
    Instant timestamp,
    Double requestRate,
    Double errorRate,
    Double latencyP95,
    Double latencyP99,
    Double cpuUsage,
    Double memoryUsage,
    Integer restartCount,
    Integer podCount
) {
  public static HealthView of(ServiceHealth h) {
    MetricSample s = h.latestSample();
    String anomaly = h.activeAnomaly() == null ? null : h.activeAnomaly().label();
    if (s == null) {
      return new HealthView(h.serviceName(), h.score(), h.status().label(), h.factors(), anomaly,
          null, null, null, null, null, null, null, null, null);
    }
    return new HealthView(h.serviceName(), h.score(), h.status().label(), h.factors(), anomaly,
        s.timestamp(), s.requestRate(), s.errorRate(), s.latencyP95(), s.latencyP99(), s.cpuUsage(), s.memoryUsage(),
        s.restartCount(), s.podCount());
  }
}

package com.observatory.api.model;

import com.observatory.anomaly.model.MetricSample;

import java.time.Instant;

public record MetricPoint(
    Instant timestamp,
    double requestRate,
    double errorRate,
    double latencyP50,
    double latencyP95,
    double latencyP99,
    double cpuUsage,
    double memoryUsage,
    int restartCount,
    int podCount
) {
  public static MetricPoint of(MetricSample s) {
    return new MetricPoint(s.timestamp(), s.requestRate(), s.errorRate(), s.latencyP50(), s.latencyP95(),
        s.latencyP99(), s.cpuUsage(), s.memoryUsage(), s.restartCount(), s.podCount());
  }
}

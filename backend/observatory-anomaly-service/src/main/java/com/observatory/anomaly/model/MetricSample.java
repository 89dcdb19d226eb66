package com.observatory.anomaly.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One collection tick for one service. Latencies are milliseconds, CPU is cores in use
 * and memory is the fraction of the configured limit.
 */
public record MetricSample(
    String serviceName,
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
  public MetricSample {
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}

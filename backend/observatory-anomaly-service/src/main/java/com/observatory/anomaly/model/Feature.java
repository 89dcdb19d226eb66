package com.observatory.anomaly.model;

import java.util.List;

/**
 * Dimensions of the detection feature vector, in vector order.
 */
public enum Feature {
  REQUEST_RATE("request_rate"),
  ERROR_RATE("error_rate"),
  LATENCY_P95("latency_p95"),
  LATENCY_P99("latency_p99"),
  CPU_USAGE("cpu_usage"),
  MEMORY_USAGE("memory_usage");

  public static final List<Feature> VECTOR = List.of(values());

  private final String metricName;

  Feature(String metricName) {
    this.metricName = metricName;
  }

  public String metricName() {
    return metricName;
  }

  public double extract(MetricSample sample) {
    return switch (this) {
      case REQUEST_RATE -> sample.requestRate();
      case ERROR_RATE -> sample.errorRate();
      case LATENCY_P95 -> sample.latencyP95();
      case LATENCY_P99 -> sample.latencyP99();
      case CPU_USAGE -> sample.cpuUsage();
      case MEMORY_USAGE -> sample.memoryUsage();
    };
  }
}

package com.observatory.anomaly.model;

import java.util.List;

/**
 * Health view of one service. {@code score} is null while the service has never been sampled.
 */
public record ServiceHealth(
    String serviceName,
    Integer score,
    HealthStatus status,
    List<String> factors,
    MetricSample latestSample,
    Severity activeAnomaly
) {
  public ServiceHealth {
    factors = factors == null ? List.of() : List.copyOf(factors);
  }

  public static ServiceHealth unknown(String serviceName) {
    return new ServiceHealth(serviceName, null, HealthStatus.UNKNOWN, List.of(), null, null);
  }
}

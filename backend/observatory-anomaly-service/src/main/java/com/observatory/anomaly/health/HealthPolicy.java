package com.observatory.anomaly.health;

import com.observatory.anomaly.model.Severity;

import java.util.List;

public record HealthPolicy(
    List<PenaltyTier> errorRate,
    List<PenaltyTier> latencyP99,
    List<PenaltyTier> cpu,
    List<PenaltyTier> memory,
    List<PenaltyTier> restarts,
    AnomalyDeductions anomaly
) {

  public static final HealthPolicy DEFAULTS = new HealthPolicy(null, null, null, null, null, null);

  public HealthPolicy {
    errorRate = orDefault(errorRate, List.of(
        new PenaltyTier(0.01, 5), new PenaltyTier(0.05, 15), new PenaltyTier(0.10, 30)));
    latencyP99 = orDefault(latencyP99, List.of(
        new PenaltyTier(200, 5), new PenaltyTier(500, 15), new PenaltyTier(1000, 25)));
    cpu = orDefault(cpu, List.of(new PenaltyTier(0.70, 10), new PenaltyTier(0.90, 20)));
    memory = orDefault(memory, List.of(new PenaltyTier(0.80, 10), new PenaltyTier(0.95, 20)));
    restarts = orDefault(restarts, List.of(
        new PenaltyTier(0, 5), new PenaltyTier(3, 10), new PenaltyTier(10, 20)));
    anomaly = anomaly == null ? AnomalyDeductions.DEFAULTS : anomaly;
  }

  private static List<PenaltyTier> orDefault(List<PenaltyTier> tiers, List<PenaltyTier> defaults) {
    return tiers == null || tiers.isEmpty() ? defaults : List.copyOf(tiers);
  }

  public record AnomalyDeductions(Integer critical, Integer high, Integer medium, Integer low) {
    public static final AnomalyDeductions DEFAULTS = new AnomalyDeductions(40, 25, 15, 5);

    public AnomalyDeductions {
      critical = critical == null ? 40 : critical;
      high = high == null ? 25 : high;
      medium = medium == null ? 15 : medium;
      low = low == null ? 5 : low;
      if (critical < 0 || high < 0 || medium < 0 || low < 0) {
        throw new IllegalArgumentException("Anomaly deductions must not be negative");
      }
    }

    public int forSeverity(Severity severity) {
      return switch (severity) {
        case CRITICAL -> critical;
        case HIGH -> high;
        case MEDIUM -> medium;
        case LOW -> low;
      };
    }
  }
}

package com.observatory.anomaly.health;

import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.MetricSample;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Starts from 100 and subtracts, per metric, the penalty of the highest tier the latest sample
 * exceeds, then the deduction for the active anomaly. The result is clamped to [0,100].
 */
public class HealthScorer {

  private final HealthPolicy policy;

  public HealthScorer(HealthPolicy policy) {
    this.policy = policy;
  }

  public HealthAssessment assess(MetricSample latest, AnomalyRecord activeAnomaly) {
    int score = 100;
    List<String> factors = new ArrayList<>();

    score -= penalize("error_rate", latest.errorRate(), policy.errorRate(), factors);
    score -= penalize("latency_p99", latest.latencyP99(), policy.latencyP99(), factors);
    score -= penalize("cpu_usage", latest.cpuUsage(), policy.cpu(), factors);
    score -= penalize("memory_usage", latest.memoryUsage(), policy.memory(), factors);
    score -= penalize("restart_count", latest.restartCount(), policy.restarts(), factors);

    if (activeAnomaly != null) {
      int deduction = policy.anomaly().forSeverity(activeAnomaly.severity());
      if (deduction > 0) {
        score -= deduction;
        factors.add(activeAnomaly.severity().label() + " anomaly (-" + deduction + ")");
      }
    }
    return new HealthAssessment(Math.max(0, Math.min(100, score)), factors);
  }

  private static int penalize(String metric, double value, List<PenaltyTier> tiers, List<String> factors) {
    PenaltyTier applied = null;
    for (PenaltyTier tier : tiers) {
      if (value > tier.above() && (applied == null || tier.penalty() > applied.penalty())) {
        applied = tier;
      }
    }
    if (applied == null || applied.penalty() == 0) {
      return 0;
    }
    factors.add(String.format(Locale.ROOT, "%s %s above %s (-%d)",
        metric, format(value), format(applied.above()), applied.penalty()));
    return applied.penalty();
  }

  private static String format(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e9) {
      return Long.toString((long) value);
    }
    return String.format(Locale.ROOT, "%.4f", value).replaceAll("0+$", "").replaceAll("\\.$", "");
  }
}

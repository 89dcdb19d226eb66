package com.observatory.anomaly.health;

import com.observatory.anomaly.model.HealthStatus;

import java.util.List;

public record HealthAssessment(int score, List<String> factors) {
  public HealthAssessment {
    if (score < 0 || score > 100) {
      throw new IllegalArgumentException("Health score outside [0,100]: " + score);
    }
    factors = List.copyOf(factors);
  }

  public HealthStatus status() {
    return HealthStatus.fromScore(score);
  }
}

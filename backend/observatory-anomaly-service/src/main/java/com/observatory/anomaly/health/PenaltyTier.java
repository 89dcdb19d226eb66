package com.observatory.anomaly.health;

/**
 * Deduct {@code penalty} points once a value is strictly above {@code above}.
 */
public record PenaltyTier(double above, int penalty) {
  public PenaltyTier {
    if (penalty < 0) {
      throw new IllegalArgumentException("Penalty must not be negative: " + penalty);
    }
  }
}

package com.observatory.anomaly.detect;

import java.util.List;

public record TailEvaluation(double raw, double normalized, List<TailProbability> tails) {
  public TailEvaluation {
    tails = List.copyOf(tails);
  }

  public DetectorScore toScore() {
    return new DetectorScore(DetectorKind.EMPIRICAL_TAIL, raw, normalized);
  }
}

package com.observatory.anomaly.detect;

import com.observatory.anomaly.model.Feature;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Empirical-cumulative-distribution outlier score (ECOD style). For every dimension the current
 * value gets the smaller of its left and right tail probabilities under the ECDF of the history
 * plus the current value itself, so a new extreme scores {@code 1/(n+1)} rather than zero. The raw
 * score sums {@code -ln p} over dimensions and depends only on ranks.
 *
 * <p>The normalized score is the larger of two parts. The rank part maps a raw score of
 * {@code D ln 2} to 0 and {@code D ln(n+1)} (every dimension at a new extreme) to 1, scaled down by
 * {@code rankWeight}. The excursion part {@code e / (e + excursionScale)} measures how far the most
 * displaced dimension lies beyond its historical min/max, in units of its historical range.
 */
public class EmpiricalTailDetector implements OutlierDetector {

  public static final double DEFAULT_RANK_WEIGHT = 0.4;
  public static final double DEFAULT_EXCURSION_SCALE = 3.0;

  private static final double LN2 = Math.log(2.0);

  private final double probabilityFloor;
  private final double rankWeight;
  private final double excursionScale;

  public EmpiricalTailDetector(double probabilityFloor) {
    this(probabilityFloor, DEFAULT_RANK_WEIGHT, DEFAULT_EXCURSION_SCALE);
  }

  public EmpiricalTailDetector(double probabilityFloor, double rankWeight, double excursionScale) {
    if (probabilityFloor <= 0.0 || probabilityFloor >= 0.5) {
      throw new IllegalArgumentException("Probability floor must lie in (0,0.5): " + probabilityFloor);
    }
    if (rankWeight <= 0.0 || rankWeight > 1.0) {
      throw new IllegalArgumentException("Rank weight must lie in (0,1]: " + rankWeight);
    }
    if (excursionScale <= 0.0) {
      throw new IllegalArgumentException("Excursion scale must be positive: " + excursionScale);
    }
    this.probabilityFloor = probabilityFloor;
    this.rankWeight = rankWeight;
    this.excursionScale = excursionScale;
  }

  @Override
  public DetectorKind kind() {
    return DetectorKind.EMPIRICAL_TAIL;
  }

  /** Excursion at which a single dimension contributes half of the normalized score. */
  public double excursionScale() {
    return excursionScale;
  }

  @Override
  public DetectorScore score(FeatureMatrix window) {
    return evaluate(window).toScore();
  }

  public TailEvaluation evaluate(FeatureMatrix window) {
    double[] current = window.current();
    int n = window.historySize();
    List<TailProbability> tails = new ArrayList<>(window.dimensions());
    double raw = 0.0;
    double maxExcursion = 0.0;

    for (int d = 0; d < window.dimensions(); d++) {
      double x = current[d];
      int atOrBelow = 1;
      int atOrAbove = 1;
      double lo = window.value(0, d);
      double hi = lo;
      for (int i = 0; i < n; i++) {
        double v = window.value(i, d);
        if (v <= x) atOrBelow++;
        if (v >= x) atOrAbove++;
        lo = Math.min(lo, v);
        hi = Math.max(hi, v);
      }
      double p = Math.min(atOrBelow, atOrAbove) / (double) (n + 1);
      p = Math.max(p, probabilityFloor);
      raw += -Math.log(p);

      double excursion = excursion(x, lo, hi);
      maxExcursion = Math.max(maxExcursion, excursion);
      tails.add(new TailProbability(Feature.VECTOR.get(d), p, x > median(window.historyColumn(d)), excursion));
    }
    double normalized = Math.max(rankWeight * rankPart(raw, window.dimensions(), n), excursionPart(maxExcursion));
    return new TailEvaluation(raw, normalized, tails);
  }

  static double excursion(double x, double lo, double hi) {
    double beyond = Math.max(0.0, Math.max(x - hi, lo - x));
    if (beyond == 0.0) return 0.0;
    return hi > lo ? beyond / (hi - lo) : Double.POSITIVE_INFINITY;
  }

  static double rankPart(double raw, int dimensions, int historySize) {
    double span = Math.log(historySize + 1.0) - LN2;
    if (span <= 0.0) return 0.0;
    double v = (raw - dimensions * LN2) / (dimensions * span);
    return Math.min(1.0, Math.max(0.0, v));
  }

  double excursionPart(double excursion) {
    if (Double.isInfinite(excursion)) return 1.0;
    return excursion / (excursion + excursionScale);
  }

  static double median(double[] values) {
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
  }
}

package com.observatory.anomaly.detect;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestDetectorTest {

  private final IsolationForestDetector detector = new IsolationForestDetector(100, 0, 42L);

  @Test
  void averagePathLength() {
    assertThat(IsolationForestDetector.averagePathLength(0)).isEqualTo(0.0);
    assertThat(IsolationForestDetector.averagePathLength(1)).isEqualTo(0.0);
    assertThat(IsolationForestDetector.averagePathLength(2)).isEqualTo(1.0);
    assertThat(IsolationForestDetector.averagePathLength(3)).isCloseTo(5.0 / 3.0, within(1e-12));
    assertThat(IsolationForestDetector.averagePathLength(25)).isCloseTo(5.631916355507, within(1e-9));
  }

  @Test
  void depthLimitIsCeilingOfLog2() {
    assertThat(IsolationForestDetector.ceilLog2(1)).isEqualTo(0);
    assertThat(IsolationForestDetector.ceilLog2(2)).isEqualTo(1);
    assertThat(IsolationForestDetector.ceilLog2(8)).isEqualTo(3);
    assertThat(IsolationForestDetector.ceilLog2(9)).isEqualTo(4);
    assertThat(IsolationForestDetector.ceilLog2(25)).isEqualTo(5);
  }

  @Test
  void interpolatedQuartiles() {
    double[] sorted = {1, 2, 3, 4, 5};
    assertThat(IsolationForestDetector.quantile(sorted, 0.25)).isEqualTo(2.0);
    assertThat(IsolationForestDetector.quantile(sorted, 0.75)).isEqualTo(4.0);
    assertThat(IsolationForestDetector.quantile(new double[] {1, 2, 3, 4}, 0.25)).isCloseTo(1.75, within(1e-12));
  }

  @Test
  void spreadFallsBackToStandardDeviationWhenQuartilesCoincide() {
    double[][] rows = {{1}, {1}, {1}, {1}, {1}, {1}, {1}, {9}};

    double[] spreads = IsolationForestDetector.spreads(rows);

    // mean 2, squares 7*1 + 49 = 56 over 8 points
    assertThat(spreads[0]).isCloseTo(Math.sqrt(7.0), within(1e-12));
  }

  @Test
  void isolatedPointScoresHigherThanTypicalPoint() {
    DetectorScore spike = detector.score(WindowFixtures.errorSpike());
    DetectorScore typical = detector.score(WindowFixtures.typical());

    assertThat(spike.kind()).isEqualTo(DetectorKind.ISOLATION);
    assertThat(spike.normalized()).isCloseTo(0.8831, within(5e-4));
    assertThat(typical.normalized()).isCloseTo(0.4844, within(5e-4));
    assertThat(spike.normalized()).isGreaterThan(typical.normalized());
  }

  @Test
  void sameSeedSameScore() {
    FeatureMatrix window = WindowFixtures.errorSpike();

    double first = detector.score(window).normalized();
    double second = detector.score(window).normalized();
    double otherSeed = new IsolationForestDetector(100, 0, 7L).score(window).normalized();

    assertThat(second).isEqualTo(first);
    assertThat(otherSeed).isBetween(0.0, 1.0).isNotEqualTo(first);
  }

  @Test
  void rejectsInvalidParameters() {
    assertThatThrownBy(() -> new IsolationForestDetector(0, 0, 1L)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new IsolationForestDetector(10, -1, 1L)).isInstanceOf(IllegalArgumentException.class);
  }
}

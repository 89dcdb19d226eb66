package com.observatory.anomaly.detect;

import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.Severity;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Fuses the empirical-tail and isolation scores of the newest sample as their mean and maps the
 * result onto a severity. Features whose tail probability falls below the attribution threshold,
 * or that lie at least one excursion scale beyond their historical range, are reported as affected.
 */
public class AnomalyEnsemble {

  private final FeatureExtractor extractor;
  private final EmpiricalTailDetector empiricalTail;
  private final OutlierDetector isolation;
  private final SeverityThresholds thresholds;
  private final double attributionThreshold;
  private final Clock clock;

  public AnomalyEnsemble(FeatureExtractor extractor,
                         EmpiricalTailDetector empiricalTail,
                         OutlierDetector isolation,
                         SeverityThresholds thresholds,
                         double attributionThreshold,
                         Clock clock) {
    if (isolation.kind() != DetectorKind.ISOLATION) {
      throw new IllegalArgumentException("Second detector must be an isolation detector, got " + isolation.kind());
    }
    this.extractor = extractor;
    this.empiricalTail = empiricalTail;
    this.isolation = isolation;
    this.thresholds = thresholds;
    this.attributionThreshold = attributionThreshold;
    this.clock = clock;
  }

  /**
   * Scores the newest stored sample of {@code serviceName}.
   *
   * @throws com.observatory.anomaly.error.DetectionSkippedException when the window cannot be scored
   */
  public Optional<AnomalyRecord> detect(String serviceName) {
    EnsembleVerdict verdict = evaluate(extractor.extract(serviceName));
    if (!verdict.isAnomalous()) {
      return Optional.empty();
    }
    return Optional.of(verdict.toRecord(clock.instant()));
  }

  public EnsembleVerdict evaluate(FeatureMatrix window) {
    TailEvaluation tail = empiricalTail.evaluate(window);
    DetectorScore isolationScore = isolation.score(window);
    double fused = (tail.normalized() + isolationScore.normalized()) / 2.0;
    fused = Math.min(1.0, Math.max(0.0, fused));

    Severity severity = thresholds.classify(fused).orElse(null);
    List<TailProbability> attributed = tail.tails().stream()
        .filter(t -> t.probability() < attributionThreshold || t.excursion() >= empiricalTail.excursionScale())
        .toList();
    String description = severity == null
        ? null
        : AnomalyDescriber.describe(window.serviceName(), severity, attributed);

    return new EnsembleVerdict(window.serviceName(), window.currentTimestamp(), tail.toScore(), isolationScore,
        fused, severity, attributed, description);
  }
}

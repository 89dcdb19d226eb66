package com.observatory.anomaly.service;

import com.observatory.anomaly.config.ObservatoryProperties;
import com.observatory.anomaly.detect.AnomalyEnsemble;
import com.observatory.anomaly.error.DetectionSkippedException;
import com.observatory.anomaly.error.PersistenceFailureException;
import com.observatory.anomaly.error.SourceUnavailableException;
import com.observatory.anomaly.health.HealthAssessment;
import com.observatory.anomaly.health.HealthScorer;
import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.CollectionResult;
import com.observatory.anomaly.model.MetricSample;
import com.observatory.anomaly.source.MetricsSource;
import com.observatory.anomaly.store.MetricStore;
import com.observatory.anomaly.store.StoreOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One service, one tick: fetch, store, detect, score. Never throws for expected failures; the
 * outcome says what happened.
 */
@Component
public class ServiceCollector {

  private static final Logger log = LoggerFactory.getLogger(ServiceCollector.class);

  private final MetricsSource source;
  private final MetricStore store;
  private final AnomalyEnsemble ensemble;
  private final HealthScorer scorer;
  private final AnomalyEventPublisher publisher;
  private final Clock clock;
  private final Duration backfillWindow;
  private final Duration backfillStep;
  private final MeterRegistry metrics;
  private final Counter sourceFailures;
  private final Counter storeFailures;
  private final Counter anomaliesEmitted;

  public ServiceCollector(MetricsSource source,
                          MetricStore store,
                          AnomalyEnsemble ensemble,
                          HealthScorer scorer,
                          AnomalyEventPublisher publisher,
                          Clock clock,
                          ObservatoryProperties props,
                          MeterRegistry metrics) {
    this.source = source;
    this.store = store;
    this.ensemble = ensemble;
    this.scorer = scorer;
    this.publisher = publisher;
    this.clock = clock;
    this.backfillWindow = props.collection().backfillWindow();
    this.backfillStep = props.collection().backfillStep();
    this.metrics = metrics;
    this.sourceFailures = metrics.counter("observatory_source_failures_total");
    this.storeFailures = metrics.counter("observatory_store_failures_total");
    this.anomaliesEmitted = metrics.counter("observatory_anomalies_emitted_total");
  }

  public CollectionResult collect(String serviceName) {
    Instant timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Optional<MetricSample> fetched;
    try {
      fetched = source.fetchSample(serviceName, timestamp);
    } catch (SourceUnavailableException e) {
      sourceFailures.increment();
      log.warn("[collect] Source unavailable for {}: {}", serviceName, e.getMessage());
      return CollectionResult.failed(serviceName, e.getMessage());
    }
    if (fetched.isEmpty()) {
      return CollectionResult.noData(serviceName);
    }

    MetricSample sample = fetched.get();
    try {
      if (store.saveSample(sample) == StoreOutcome.DUPLICATE) {
        log.debug("[collect] Duplicate sample for {} at {}", serviceName, sample.timestamp());
        return CollectionResult.duplicate(sample);
      }
      store.touchService(serviceName, sample.timestamp());

      AnomalyRecord anomaly = null;
      String skipped = null;
      Optional<AnomalyRecord> detected = Optional.empty();
      try {
        detected = ensemble.detect(serviceName);
      } catch (DetectionSkippedException e) {
        metrics.counter("observatory_detection_skipped_total", "reason", e.reason()).increment();
        log.debug("[collect] Detection skipped for {}: {}", serviceName, e.getMessage());
        skipped = e.getMessage();
      } catch (PersistenceFailureException e) {
        // The sample is already stored; only the window read failed.
        storeFailures.increment();
        metrics.counter("observatory_detection_skipped_total", "reason", "window_unavailable").increment();
        log.warn("[collect] Detection window unavailable for {}: {}", serviceName, e.getMessage());
        skipped = "detection window unavailable: " + e.getMessage();
      }
      if (detected.isPresent()) {
        anomaly = store.appendAnomaly(detected.get());
        anomaliesEmitted.increment();
        log.info("[collect] {} anomaly for {} score={} metrics={}", anomaly.severity().label(), serviceName,
            String.format(Locale.ROOT, "%.3f", anomaly.anomalyScore()), anomaly.affectedMetrics());
        publisher.publish(anomaly);
      }

      HealthAssessment health = scorer.assess(sample, anomaly);
      return CollectionResult.stored(sample, anomaly, health, skipped);
    } catch (PersistenceFailureException e) {
      storeFailures.increment();
      log.error("[collect] Store failure for {}: {}", serviceName, e.getMessage(), e);
      return CollectionResult.failed(serviceName, e.getMessage());
    }
  }

  /**
   * Seeds an empty service with the source's recent history so detection does not wait for a full
   * window of ticks. Returns the number of samples stored.
   */
  public int backfill(String serviceName) {
    try {
      if (store.latestSample(serviceName).isPresent()) {
        log.info("[backfill] {} already has samples, skipping", serviceName);
        return 0;
      }
      Instant end = clock.instant().truncatedTo(ChronoUnit.SECONDS);
      List<MetricSample> history = source.fetchHistory(serviceName, end.minus(backfillWindow), end, backfillStep);
      int stored = 0;
      for (MetricSample sample : history) {
        if (store.saveSample(sample) == StoreOutcome.STORED) stored++;
      }
      if (stored > 0) {
        store.touchService(serviceName, history.get(history.size() - 1).timestamp());
      }
      log.info("[backfill] Stored {} of {} historical samples for {}", stored, history.size(), serviceName);
      return stored;
    } catch (SourceUnavailableException e) {
      sourceFailures.increment();
      log.warn("[backfill] Source unavailable for {}: {}", serviceName, e.getMessage());
      return 0;
    } catch (PersistenceFailureException e) {
      storeFailures.increment();
      log.error("[backfill] Store failure for {}: {}", serviceName, e.getMessage(), e);
      return 0;
    }
  }
}

package com.observatory.anomaly.service;

import com.observatory.anomaly.Fixtures;
import com.observatory.anomaly.config.ObservatoryProperties;
import com.observatory.anomaly.detect.AnomalyEnsemble;
import com.observatory.anomaly.error.DegenerateFeatureException;
import com.observatory.anomaly.error.InsufficientDataException;
import com.observatory.anomaly.error.PersistenceFailureException;
import com.observatory.anomaly.error.SourceUnavailableException;
import com.observatory.anomaly.health.HealthPolicy;
import com.observatory.anomaly.health.HealthScorer;
import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.CollectionResult;
import com.observatory.anomaly.model.CollectionResult.Outcome;
import com.observatory.anomaly.model.Feature;
import com.observatory.anomaly.model.MetricSample;
import com.observatory.anomaly.model.Severity;
import com.observatory.anomaly.source.MetricsSource;
import com.observatory.anomaly.store.MetricStore;
import com.observatory.anomaly.store.StoreOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ServiceCollectorTest {

  private static final Instant NOW = Fixtures.hour(24).plusMillis(400);

  private final MetricsSource source = mock(MetricsSource.class);
  private final MetricStore store = mock(MetricStore.class);
  private final AnomalyEnsemble ensemble = mock(AnomalyEnsemble.class);
  private final AnomalyEventPublisher publisher = mock(AnomalyEventPublisher.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ServiceCollector collector = new ServiceCollector(source, store, ensemble,
      new HealthScorer(HealthPolicy.DEFAULTS), publisher, Clock.fixed(NOW, ZoneOffset.UTC),
      new ObservatoryProperties(null, null, null, null, null, null), registry);

  @Test
  void storedSampleIsScoredAndAnomalyPublished() {
    MetricSample sample = Fixtures.withErrorRate("checkout", 24, 0.45);
    AnomalyRecord detected = anomaly(null);
    AnomalyRecord saved = anomaly(7L);
    when(source.fetchSample("checkout", Fixtures.hour(24))).thenReturn(Optional.of(sample));
    when(store.saveSample(sample)).thenReturn(StoreOutcome.STORED);
    when(ensemble.detect("checkout")).thenReturn(Optional.of(detected));
    when(store.appendAnomaly(detected)).thenReturn(saved);

    CollectionResult result = collector.collect("checkout");

    assertThat(result.outcome()).isEqualTo(Outcome.STORED);
    assertThat(result.anomaly()).isEqualTo(saved);
    assertThat(result.health().score()).isEqualTo(45);
    verify(store).touchService("checkout", Fixtures.hour(24));
    verify(publisher).publish(saved);
    assertThat(registry.counter("observatory_anomalies_emitted_total").count()).isEqualTo(1.0);
  }

  @Test
  void duplicateSkipsDetection() {
    MetricSample sample = Fixtures.steady("checkout", 24);
    when(source.fetchSample(eq("checkout"), any())).thenReturn(Optional.of(sample));
    when(store.saveSample(sample)).thenReturn(StoreOutcome.DUPLICATE);

    CollectionResult result = collector.collect("checkout");

    assertThat(result.outcome()).isEqualTo(Outcome.DUPLICATE);
    verifyNoInteractions(ensemble, publisher);
    verify(store, never()).touchService(anyString(), any());
  }

  @Test
  void sourceFailureIsFailedWithoutTouchingStore() {
    when(source.fetchSample(eq("checkout"), any())).thenThrow(new SourceUnavailableException("timeout"));

    CollectionResult result = collector.collect("checkout");

    assertThat(result.outcome()).isEqualTo(Outcome.FAILED);
    assertThat(result.detail()).isEqualTo("timeout");
    verifyNoInteractions(store, ensemble);
    assertThat(registry.counter("observatory_source_failures_total").count()).isEqualTo(1.0);
  }

  @Test
  void noDataIsReportedAndNothingStored() {
    when(source.fetchSample(eq("ghost"), any())).thenReturn(Optional.empty());

    assertThat(collector.collect("ghost").outcome()).isEqualTo(Outcome.NO_DATA);
    verifyNoInteractions(store);
  }

  @Test
  void skippedDetectionStillStoresAndScoresRawSample() {
    MetricSample sample = Fixtures.steady("checkout", 3);
    when(source.fetchSample(eq("checkout"), any())).thenReturn(Optional.of(sample));
    when(store.saveSample(sample)).thenReturn(StoreOutcome.STORED);
    when(ensemble.detect("checkout")).thenThrow(new InsufficientDataException("checkout", 4, 10));

    CollectionResult result = collector.collect("checkout");

    assertThat(result.outcome()).isEqualTo(Outcome.STORED);
    assertThat(result.anomaly()).isNull();
    assertThat(result.health().score()).isBetween(95, 100);
    assertThat(result.detail()).contains("need 10");
    assertThat(registry.counter("observatory_detection_skipped_total", "reason", "insufficient_data").count())
        .isEqualTo(1.0);
  }

  @Test
  void degenerateFeatureIsAlsoASkip() {
    MetricSample sample = Fixtures.steady("checkout", 12);
    when(source.fetchSample(eq("checkout"), any())).thenReturn(Optional.of(sample));
    when(store.saveSample(sample)).thenReturn(StoreOutcome.STORED);
    when(ensemble.detect("checkout")).thenThrow(new DegenerateFeatureException("checkout", Feature.LATENCY_P95));

    CollectionResult result = collector.collect("checkout");

    assertThat(result.outcome()).isEqualTo(Outcome.STORED);
    assertThat(result.detail()).contains("latency_p95");
  }

  @Test
  void storeFailureIsFailed() {
    MetricSample sample = Fixtures.steady("checkout", 12);
    when(source.fetchSample(eq("checkout"), any())).thenReturn(Optional.of(sample));
    when(store.saveSample(sample)).thenThrow(new PersistenceFailureException("db down",
        new DataAccessResourceFailureException("connection lost")));

    CollectionResult result = collector.collect("checkout");

    assertThat(result.outcome()).isEqualTo(Outcome.FAILED);
    verifyNoInteractions(ensemble);
  }

  @Test
  void windowReadFailureKeepsTheStoredSampleAndScoresIt() {
    MetricSample sample = Fixtures.withErrorRate("checkout", 24, 0.45);
    when(source.fetchSample(eq("checkout"), any())).thenReturn(Optional.of(sample));
    when(store.saveSample(sample)).thenReturn(StoreOutcome.STORED);
    when(ensemble.detect("checkout")).thenThrow(new PersistenceFailureException("window read failed",
        new DataAccessResourceFailureException("connection lost")));

    CollectionResult result = collector.collect("checkout");

    assertThat(result.outcome()).isEqualTo(Outcome.STORED);
    assertThat(result.anomaly()).isNull();
    assertThat(result.health().score()).isEqualTo(70);
    assertThat(result.detail()).contains("window unavailable");
    verify(store).touchService("checkout", Fixtures.hour(24));
    verify(store, never()).appendAnomaly(any());
    verifyNoInteractions(publisher);
    assertThat(registry.counter("observatory_store_failures_total").count()).isEqualTo(1.0);
    assertThat(registry.counter("observatory_detection_skipped_total", "reason", "window_unavailable").count())
        .isEqualTo(1.0);
  }

  @Test
  void backfillSeedsEmptyServiceInOrder() {
    List<MetricSample> history = Fixtures.steadySeries("checkout", 3);
    when(store.latestSample("checkout")).thenReturn(Optional.empty());
    when(source.fetchHistory(eq("checkout"), any(), any(), eq(Duration.ofMinutes(1)))).thenReturn(history);
    when(store.saveSample(any())).thenReturn(StoreOutcome.STORED);

    assertThat(collector.backfill("checkout")).isEqualTo(3);
    verify(source).fetchHistory("checkout", Fixtures.hour(22), Fixtures.hour(24), Duration.ofMinutes(1));
    verify(store).touchService("checkout", Fixtures.hour(2));
  }

  @Test
  void backfillSkipsServicesWithSamplesAndSurvivesSourceFailure() {
    when(store.latestSample("checkout")).thenReturn(Optional.of(Fixtures.steady("checkout", 1)));
    assertThat(collector.backfill("checkout")).isZero();

    when(store.latestSample("payments")).thenReturn(Optional.empty());
    when(source.fetchHistory(eq("payments"), any(), any(), any())).thenThrow(new SourceUnavailableException("down"));
    assertThat(collector.backfill("payments")).isZero();
  }

  private static AnomalyRecord anomaly(Long id) {
    return new AnomalyRecord(id, "checkout", Fixtures.hour(24), AnomalyRecord.METRIC_DEVIATION, Severity.HIGH,
        0.94, List.of("error_rate"), "High anomaly on checkout: error_rate above historical norm", NOW);
  }
}

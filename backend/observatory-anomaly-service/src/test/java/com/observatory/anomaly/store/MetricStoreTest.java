package com.observatory.anomaly.store;

import com.observatory.anomaly.Fixtures;
import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.MetricSample;
import com.observatory.anomaly.model.ServiceRegistration;
import com.observatory.anomaly.model.Severity;
import com.observatory.anomaly.repo.DbMetricSampleRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(MetricStore.class)
class MetricStoreTest {

  @Autowired
  private MetricStore store;

  @Autowired
  private DbMetricSampleRepository sampleRepo;

  @Test
  void sameServiceAndTimestampIsStoredOnce() {
    MetricSample sample = Fixtures.steady("checkout", 0);

    assertThat(store.saveSample(sample)).isEqualTo(StoreOutcome.STORED);
    assertThat(store.saveSample(sample)).isEqualTo(StoreOutcome.DUPLICATE);

    assertThat(sampleRepo.count()).isEqualTo(1);
  }

  @Test
  void olderTimestampThanLatestIsDuplicate() {
    store.saveSample(Fixtures.steady("checkout", 5));

    assertThat(store.saveSample(Fixtures.steady("checkout", 3))).isEqualTo(StoreOutcome.DUPLICATE);
    assertThat(store.saveSample(Fixtures.steady("checkout", 6))).isEqualTo(StoreOutcome.STORED);
    assertThat(store.saveSample(Fixtures.steady("payments", 3))).isEqualTo(StoreOutcome.STORED);
  }

  @Test
  void recentWindowKeepsNewestSamplesOldestFirst() {
    Fixtures.steadySeries("checkout", 8).forEach(store::saveSample);

    List<MetricSample> window = store.recentWindow("checkout", Fixtures.hour(1), 4);

    assertThat(window).extracting(MetricSample::timestamp)
        .containsExactly(Fixtures.hour(4), Fixtures.hour(5), Fixtures.hour(6), Fixtures.hour(7));
    assertThat(window.get(3)).isEqualTo(Fixtures.steady("checkout", 7));
  }

  @Test
  void historyIncludesLowerBound() {
    Fixtures.steadySeries("checkout", 5).forEach(store::saveSample);

    assertThat(store.history("checkout", Fixtures.hour(2))).hasSize(3);
    assertThat(store.history("unknown", Fixtures.hour(0))).isEmpty();
    assertThat(store.latestSample("checkout")).contains(Fixtures.steady("checkout", 4));
  }

  @Test
  void registrationIsAnUpsertKeepingFirstSeen() {
    Instant first = Instant.parse("2026-01-01T00:00:00Z");

    assertThat(store.register("checkout", "http", first)).isTrue();
    assertThat(store.register("checkout", "grpc", first.plusSeconds(600))).isFalse();

    ServiceRegistration reg = store.findService("checkout").orElseThrow();
    assertThat(reg.serviceType()).isEqualTo("http");
    assertThat(reg.firstSeen()).isEqualTo(first);
    assertThat(reg.isActive()).isTrue();
    assertThat(store.listServices()).hasSize(1);
  }

  @Test
  void touchRegistersUnknownServiceAndOnlyMovesLastSeenForward() {
    store.touchService("inventory", Fixtures.hour(3));
    store.touchService("inventory", Fixtures.hour(1));

    ServiceRegistration reg = store.findService("inventory").orElseThrow();
    assertThat(reg.serviceType()).isEqualTo(ServiceRegistration.UNKNOWN_TYPE);
    assertThat(reg.firstSeen()).isEqualTo(Fixtures.hour(3));
    assertThat(reg.lastSeen()).isEqualTo(Fixtures.hour(3));
    assertThat(store.activeServices()).extracting(ServiceRegistration::serviceName).containsExactly("inventory");
  }

  @Test
  void activeAnomalyMatchesOnlyTheLatestSample() {
    AnomalyRecord saved = store.appendAnomaly(anomaly("checkout", Fixtures.hour(2), Severity.HIGH));

    assertThat(saved.id()).isNotNull();
    assertThat(saved.affectedMetrics()).containsExactly("error_rate", "latency_p99");
    assertThat(store.activeAnomaly("checkout", Fixtures.hour(2))).contains(saved);
    assertThat(store.activeAnomaly("checkout", Fixtures.hour(3))).isEmpty();
  }

  @Test
  void anomaliesFilterByServiceAndTimeNewestFirst() {
    store.appendAnomaly(anomaly("checkout", Fixtures.hour(1), Severity.LOW));
    store.appendAnomaly(anomaly("checkout", Fixtures.hour(5), Severity.CRITICAL));
    store.appendAnomaly(anomaly("payments", Fixtures.hour(3), Severity.MEDIUM));

    assertThat(store.anomalies(null, null, null)).extracting(AnomalyRecord::timestamp)
        .containsExactly(Fixtures.hour(5), Fixtures.hour(3), Fixtures.hour(1));
    assertThat(store.anomalies("checkout", null, null)).hasSize(2);
    assertThat(store.anomalies(null, Fixtures.hour(2), Fixtures.hour(5))).extracting(AnomalyRecord::serviceName)
        .containsExactly("payments");
  }

  private static AnomalyRecord anomaly(String service, Instant ts, Severity severity) {
    return new AnomalyRecord(null, service, ts, AnomalyRecord.METRIC_DEVIATION, severity, 0.9,
        List.of("error_rate", "latency_p99"), "test anomaly", ts.plusSeconds(1));
  }
}

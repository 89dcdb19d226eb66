package com.observatory.anomaly.service;

import com.observatory.anomaly.config.ObservatoryProperties;
import com.observatory.anomaly.health.HealthAssessment;
import com.observatory.anomaly.health.HealthScorer;
import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.CollectionResult;
import com.observatory.anomaly.model.MetricSample;
import com.observatory.anomaly.model.RegistrationResult;
import com.observatory.anomaly.model.ServiceHealth;
import com.observatory.anomaly.model.ServiceRegistration;
import com.observatory.anomaly.store.MetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Read and trigger operations for the HTTP layer. Health is derived on demand from the latest
 * sample and the anomaly raised for it.
 */
@Service
public class MonitoringService {

  private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

  private final MetricStore store;
  private final HealthScorer scorer;
  private final ServiceCollector collector;
  private final CollectionScheduler scheduler;
  private final Clock clock;
  private final Duration manualTimeout;

  public MonitoringService(MetricStore store,
                           HealthScorer scorer,
                           ServiceCollector collector,
                           CollectionScheduler scheduler,
                           Clock clock,
                           ObservatoryProperties props) {
    this.store = store;
    this.scorer = scorer;
    this.collector = collector;
    this.scheduler = scheduler;
    this.clock = clock;
    this.manualTimeout = props.scheduler().period();
  }

  public List<ServiceRegistration> listServices() {
    return store.listServices();
  }

  public RegistrationResult registerService(String serviceName, String serviceType, boolean backfill) {
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalArgumentException("service_name is required");
    }
    String name = serviceName.trim();
    boolean created = store.register(name, serviceType, clock.instant().truncatedTo(ChronoUnit.SECONDS));
    int backfilled = backfill ? collector.backfill(name) : 0;
    ServiceRegistration registration = store.findService(name)
        .orElseThrow(() -> new IllegalStateException("Registration of " + name + " not visible after write"));
    return new RegistrationResult(registration, created, backfilled);
  }

  public List<ServiceHealth> healthSummary() {
    return store.listServices().stream()
        .map(s -> health(s.serviceName()))
        .toList();
  }

  /** Empty when the service is neither registered nor sampled. */
  public Optional<ServiceHealth> serviceHealth(String serviceName) {
    if (store.findService(serviceName).isEmpty() && store.latestSample(serviceName).isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(health(serviceName));
  }

  private ServiceHealth health(String serviceName) {
    Optional<MetricSample> latest = store.latestSample(serviceName);
    if (latest.isEmpty()) {
      return ServiceHealth.unknown(serviceName);
    }
    MetricSample sample = latest.get();
    AnomalyRecord active = store.activeAnomaly(serviceName, sample.timestamp()).orElse(null);
    HealthAssessment assessment = scorer.assess(sample, active);
    return new ServiceHealth(serviceName, assessment.score(), assessment.status(), assessment.factors(), sample,
        active == null ? null : active.severity());
  }

  public List<AnomalyRecord> anomalies(String serviceName, Instant since, Instant until) {
    return store.anomalies(serviceName, since, until);
  }

  public List<MetricSample> history(String serviceName, Instant since) {
    return store.history(serviceName, since);
  }

  /**
   * Collects one service now, sharing any collection already in flight for it.
   */
  public CollectionResult collectNow(String serviceName) {
    try {
      return scheduler.submit(serviceName).get(manualTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("[collectNow] Collection for {} did not finish within {}", serviceName, manualTimeout);
      return CollectionResult.failed(serviceName, "collection did not finish within " + manualTimeout);
    } catch (ExecutionException e) {
      return CollectionResult.failed(serviceName, e.getCause().getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return CollectionResult.failed(serviceName, "interrupted");
    }
  }
}

package com.observatory.anomaly.store;

import com.observatory.anomaly.entity.DbAnomalyRecord;
import com.observatory.anomaly.entity.DbMetricSample;
import com.observatory.anomaly.entity.DbService;
import com.observatory.anomaly.error.PersistenceFailureException;
import com.observatory.anomaly.model.AnomalyRecord;
import com.observatory.anomaly.model.MetricSample;
import com.observatory.anomaly.model.ServiceRegistration;
import com.observatory.anomaly.model.Severity;
import com.observatory.anomaly.repo.DbAnomalyRecordRepository;
import com.observatory.anomaly.repo.DbMetricSampleRepository;
import com.observatory.anomaly.repo.DbServiceRepository;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Store boundary for samples, anomalies and registrations. Every write is a single repository call
 * in its own transaction; Spring data-access failures surface as {@link PersistenceFailureException}.
 */
@Component
public class MetricStore {

  private static final Logger log = LoggerFactory.getLogger(MetricStore.class);

  private final DbMetricSampleRepository samples;
  private final DbAnomalyRecordRepository anomalies;
  private final DbServiceRepository services;

  public MetricStore(DbMetricSampleRepository samples,
                     DbAnomalyRecordRepository anomalies,
                     DbServiceRepository services) {
    this.samples = samples;
    this.anomalies = anomalies;
    this.services = services;
  }

  /**
   * Stores a sample unless one with the same or a later timestamp already exists for the service.
   */
  public StoreOutcome saveSample(MetricSample sample) {
    try {
      Optional<DbMetricSample> latest = samples.findFirstByServiceNameOrderByTimestampDesc(sample.serviceName());
      if (latest.isPresent() && !latest.get().getTimestamp().isBefore(sample.timestamp())) {
        log.debug("[saveSample] {} at {} not newer than stored {}", sample.serviceName(), sample.timestamp(),
            latest.get().getTimestamp());
        return StoreOutcome.DUPLICATE;
      }
      samples.saveAndFlush(toEntity(sample));
      return StoreOutcome.STORED;
    } catch (DataIntegrityViolationException ignore) {
      // Unique constraint on (service_name, sampled_at) lost a race with another writer
      return StoreOutcome.DUPLICATE;
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to store sample for " + sample.serviceName(), e);
    }
  }

  public Optional<MetricSample> latestSample(String serviceName) {
    return read("latest sample of " + serviceName,
        () -> samples.findFirstByServiceNameOrderByTimestampDesc(serviceName).map(MetricStore::toModel));
  }

  /** Newest {@code limit} samples after {@code since}, returned oldest first. */
  public List<MetricSample> recentWindow(String serviceName, Instant since, int limit) {
    return read("window of " + serviceName, () -> {
      List<MetricSample> window = new ArrayList<>(samples
          .findByServiceNameAndTimestampAfterOrderByTimestampDesc(serviceName, since, PageRequest.of(0, limit))
          .stream().map(MetricStore::toModel).toList());
      Collections.reverse(window);
      return window;
    });
  }

  public List<MetricSample> history(String serviceName, Instant since) {
    return read("history of " + serviceName, () -> samples
        .findByServiceNameAndTimestampGreaterThanEqualOrderByTimestampAsc(serviceName, since)
        .stream().map(MetricStore::toModel).toList());
  }

  public AnomalyRecord appendAnomaly(AnomalyRecord record) {
    try {
      DbAnomalyRecord row = new DbAnomalyRecord();
      row.setServiceName(record.serviceName());
      row.setTimestamp(record.timestamp());
      row.setAnomalyType(record.anomalyType());
      row.setSeverity(record.severity().label());
      row.setAnomalyScore(record.anomalyScore());
      row.setAffectedMetrics(String.join(",", record.affectedMetrics()));
      row.setDescription(record.description());
      row.setDetectedAt(record.detectedAt());
      return toModel(anomalies.save(row));
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to store anomaly for " + record.serviceName(), e);
    }
  }

  /**
   * The anomaly raised for the sample at {@code latestTimestamp}, if any. Anomalies on older samples
   * count as resolved.
   */
  public Optional<AnomalyRecord> activeAnomaly(String serviceName, Instant latestTimestamp) {
    return read("active anomaly of " + serviceName, () -> anomalies
        .findFirstByServiceNameAndTimestampOrderByIdDesc(serviceName, latestTimestamp)
        .map(MetricStore::toModel));
  }

  /** Newest first; every filter is optional. */
  public List<AnomalyRecord> anomalies(String serviceName, Instant since, Instant until) {
    Specification<DbAnomalyRecord> spec = (root, query, cb) -> {
      var predicates = new ArrayList<Predicate>();
      if (serviceName != null && !serviceName.isBlank()) {
        predicates.add(cb.equal(root.get("serviceName"), serviceName));
      }
      if (since != null) {
        predicates.add(cb.greaterThanOrEqualTo(root.get("timestamp"), since));
      }
      if (until != null) {
        predicates.add(cb.lessThan(root.get("timestamp"), until));
      }
      query.orderBy(cb.desc(root.get("timestamp")), cb.desc(root.get("id")));
      return cb.and(predicates.toArray(new Predicate[0]));
    };
    return read("anomalies", () -> anomalies.findAll(spec).stream().map(MetricStore::toModel).toList());
  }

  public List<ServiceRegistration> listServices() {
    return read("services", () -> services.findAllByOrderByServiceNameAsc().stream()
        .map(MetricStore::toModel).toList());
  }

  public List<ServiceRegistration> activeServices() {
    return read("active services", () -> services.findByStatusOrderByServiceNameAsc(ServiceRegistration.ACTIVE)
        .stream().map(MetricStore::toModel).toList());
  }

  public Optional<ServiceRegistration> findService(String serviceName) {
    return read("service " + serviceName,
        () -> services.findByServiceName(serviceName).map(MetricStore::toModel));
  }

  /**
   * Creates the registration if it is missing and otherwise leaves it untouched.
   *
   * @return true when a new registration was created
   */
  public boolean register(String serviceName, String serviceType, Instant now) {
    try {
      if (services.findByServiceName(serviceName).isPresent()) {
        return false;
      }
      DbService row = new DbService();
      row.setServiceName(serviceName);
      row.setServiceType(serviceType == null || serviceType.isBlank() ? ServiceRegistration.UNKNOWN_TYPE : serviceType);
      row.setStatus(ServiceRegistration.ACTIVE);
      row.setFirstSeen(now);
      services.saveAndFlush(row);
      log.info("[register] Registered service {} ({})", serviceName, row.getServiceType());
      return true;
    } catch (DataIntegrityViolationException ignore) {
      return false;
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to register " + serviceName, e);
    }
  }

  /** Advances last-seen, registering the service on first sight. */
  public void touchService(String serviceName, Instant seenAt) {
    try {
      DbService row = services.findByServiceName(serviceName).orElseGet(() -> {
        DbService created = new DbService();
        created.setServiceName(serviceName);
        created.setServiceType(ServiceRegistration.UNKNOWN_TYPE);
        created.setStatus(ServiceRegistration.ACTIVE);
        created.setFirstSeen(seenAt);
        return created;
      });
      if (row.getLastSeen() == null || row.getLastSeen().isBefore(seenAt)) {
        row.setLastSeen(seenAt);
      }
      services.save(row);
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to update last-seen of " + serviceName, e);
    }
  }

  private static <T> T read(String what, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to read " + what, e);
    }
  }

  private static DbMetricSample toEntity(MetricSample s) {
    DbMetricSample row = new DbMetricSample();
    row.setServiceName(s.serviceName());
    row.setTimestamp(s.timestamp());
    row.setRequestRate(s.requestRate());
    row.setErrorRate(s.errorRate());
    row.setLatencyP50(s.latencyP50());
    row.setLatencyP95(s.latencyP95());
    row.setLatencyP99(s.latencyP99());
    row.setCpuUsage(s.cpuUsage());
    row.setMemoryUsage(s.memoryUsage());
    row.setRestartCount(s.restartCount());
    row.setPodCount(s.podCount());
    return row;
  }

  static MetricSample toModel(DbMetricSample row) {
    return new MetricSample(row.getServiceName(), row.getTimestamp(), row.getRequestRate(), row.getErrorRate(),
        row.getLatencyP50(), row.getLatencyP95(), row.getLatencyP99(), row.getCpuUsage(), row.getMemoryUsage(),
        row.getRestartCount(), row.getPodCount());
  }

  static AnomalyRecord toModel(DbAnomalyRecord row) {
    List<String> affected = row.getAffectedMetrics() == null || row.getAffectedMetrics().isBlank()
        ? List.of()
        : Arrays.asList(row.getAffectedMetrics().split(","));
    return new AnomalyRecord(row.getId(), row.getServiceName(), row.getTimestamp(), row.getAnomalyType(),
        Severity.fromLabel(row.getSeverity()), row.getAnomalyScore(), affected, row.getDescription(),
        row.getDetectedAt());
  }

  static ServiceRegistration toModel(DbService row) {
    return new ServiceRegistration(row.getServiceName(), row.getServiceType(), row.getStatus(),
        row.getFirstSeen(), row.getLastSeen());
  }
}

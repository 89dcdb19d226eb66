package com.observatory.anomaly.discover;

import com.observatory.anomaly.config.DiscoveryProperties;
import com.observatory.anomaly.error.DiscoveryUnavailableException;
import com.observatory.anomaly.error.PersistenceFailureException;
import com.observatory.anomaly.store.MetricStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Registers containers and pods found on the enabled platforms as monitored services. Registration
 * is the store's upsert, so a workload seen again keeps its first-seen time.
 */
@Service
public class DiscoveryService {

  private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

  private final List<WorkloadDiscovery> discoveries;
  private final MetricStore store;
  private final Clock clock;
  private final Duration interval;
  private final MeterRegistry metrics;

  private volatile Instant nextRefresh = Instant.MIN;

  public DiscoveryService(ObjectProvider<WorkloadDiscovery> discoveries,
                          MetricStore store,
                          Clock clock,
                          DiscoveryProperties props,
                          MeterRegistry metrics) {
    this.discoveries = discoveries.orderedStream().toList();
    this.store = store;
    this.clock = clock;
    this.interval = props.interval();
    this.metrics = metrics;
  }

  public boolean isEnabled() {
    return !discoveries.isEmpty();
  }

  /** Registers the running containers of the Docker host. */
  public DiscoveryReport discoverContainers() {
    WorkloadDiscovery docker = platform("docker")
        .orElseThrow(() -> new IllegalArgumentException("docker discovery is not enabled"));
    return register(docker.platform(), "all", docker.discover());
  }

  /** Registers the pods of one namespace, configured or not. */
  public DiscoveryReport discoverPods(String namespace) {
    KubernetesDiscovery kubernetes = discoveries.stream()
        .filter(KubernetesDiscovery.class::isInstance)
        .map(KubernetesDiscovery.class::cast)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("kubernetes discovery is not enabled"));
    String scope = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
    return register(kubernetes.platform(), scope, kubernetes.discoverPods(scope));
  }

  /**
   * Runs every enabled platform once {@code interval} has passed since the last run. A platform
   * that fails is logged and counted; the others still register.
   */
  public List<DiscoveryReport> refreshIfDue(Instant now) {
    if (discoveries.isEmpty() || now.isBefore(nextRefresh)) {
      return List.of();
    }
    nextRefresh = now.plus(interval);
    List<DiscoveryReport> reports = new ArrayList<>();
    for (WorkloadDiscovery discovery : discoveries) {
      try {
        reports.add(register(discovery.platform(), "scheduled", discovery.discover()));
      } catch (DiscoveryUnavailableException | PersistenceFailureException e) {
        metrics.counter("observatory_discovery_failures_total", "platform", discovery.platform()).increment();
        log.warn("[discover] {} discovery failed: {}", discovery.platform(), e.getMessage());
      }
    }
    return reports;
  }

  private DiscoveryReport register(String platform, String scope, List<DiscoveredWorkload> workloads) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    List<String> created = new ArrayList<>();
    for (DiscoveredWorkload workload : workloads) {
      if (store.register(workload.serviceName(), workload.serviceType(), now)) {
        created.add(workload.serviceName());
      }
    }
    metrics.counter("observatory_discovered_services_total", "platform", platform).increment(created.size());
    log.info("[discover] {} ({}): {} workloads, {} newly registered", platform, scope, workloads.size(),
        created.size());
    return new DiscoveryReport(platform, scope, workloads.size(), created);
  }

  private Optional<WorkloadDiscovery> platform(String name) {
    return discoveries.stream().filter(d -> d.platform().equals(name)).findFirst();
  }
}

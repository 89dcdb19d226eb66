package com.observatory.anomaly.source;

import com.observatory.anomaly.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds samples from the standard HTTP server, cAdvisor and kube-state-metrics series of a service.
 * Histogram quantiles come back in seconds and are stored in milliseconds; memory is the share of
 * the container limit. A metric without data counts as 0; a service without any data yields nothing.
 */
public class PrometheusMetricsSource implements MetricsSource {

  private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsSource.class);

  enum Query {
    REQUEST_RATE("sum(rate(http_requests_total{service=\"%s\"}[5m]))", 1.0),
    ERROR_RATE("sum(rate(http_requests_total{service=\"%1$s\",status=~\"5..\"}[5m]))"
        + " / sum(rate(http_requests_total{service=\"%1$s\"}[5m]))", 1.0),
    LATENCY_P50(latencyQuantile(0.50), 1000.0),
    LATENCY_P95(latencyQuantile(0.95), 1000.0),
    LATENCY_P99(latencyQuantile(0.99), 1000.0),
    CPU_USAGE("avg(rate(container_cpu_usage_seconds_total{service=\"%s\"}[5m]))", 1.0),
    MEMORY_USAGE("sum(container_memory_usage_bytes{service=\"%1$s\"})"
        + " / sum(container_spec_memory_limit_bytes{service=\"%1$s\"})", 1.0),
    RESTART_COUNT("sum(kube_pod_container_status_restarts_total{service=\"%s\"})", 1.0),
    POD_COUNT("count(kube_pod_info{service=\"%s\"})", 1.0);

    private final String template;
    private final double scale;

    Query(String template, double scale) {
      this.template = template;
      this.scale = scale;
    }

    String render(String serviceName) {
      return String.format(template, escapeLabel(serviceName));
    }

    double scale(double value) {
      return value * scale;
    }

    private static String latencyQuantile(double q) {
      return "histogram_quantile(" + q + ", sum by (le) (rate(http_request_duration_seconds_bucket{service=\"%s\"}[5m])))";
    }
  }

  private final PrometheusClient client;

  public PrometheusMetricsSource(PrometheusClient client) {
    this.client = client;
  }

  @Override
  public Optional<MetricSample> fetchSample(String serviceName, Instant timestamp) {
    Map<Query, Double> values = new EnumMap<>(Query.class);
    for (Query query : Query.values()) {
      client.query(query.render(serviceName)).ifPresent(v -> values.put(query, query.scale(v)));
    }
    if (values.isEmpty()) {
      log.info("[fetchSample] No data for service {}", serviceName);
      return Optional.empty();
    }
    return Optional.of(toSample(serviceName, timestamp.truncatedTo(ChronoUnit.SECONDS), values));
  }

  @Override
  public List<MetricSample> fetchHistory(String serviceName, Instant start, Instant end, Duration step) {
    TreeMap<Instant, Map<Query, Double>> byTimestamp = new TreeMap<>();
    for (Query query : Query.values()) {
      for (PromPoint point : client.queryRange(query.render(serviceName), start, end, step)) {
        byTimestamp.computeIfAbsent(point.timestamp().truncatedTo(ChronoUnit.SECONDS), t -> new EnumMap<>(Query.class))
            .put(query, query.scale(point.value()));
      }
    }
    List<MetricSample> history = new ArrayList<>(byTimestamp.size());
    byTimestamp.forEach((ts, values) -> history.add(toSample(serviceName, ts, values)));
    log.info("[fetchHistory] {} points for service {} between {} and {}", history.size(), serviceName, start, end);
    return history;
  }

  private static MetricSample toSample(String serviceName, Instant timestamp, Map<Query, Double> values) {
    return new MetricSample(
        serviceName,
        timestamp,
        values.getOrDefault(Query.REQUEST_RATE, 0.0),
        values.getOrDefault(Query.ERROR_RATE, 0.0),
        values.getOrDefault(Query.LATENCY_P50, 0.0),
        values.getOrDefault(Query.LATENCY_P95, 0.0),
        values.getOrDefault(Query.LATENCY_P99, 0.0),
        values.getOrDefault(Query.CPU_USAGE, 0.0),
        values.getOrDefault(Query.MEMORY_USAGE, 0.0),
        (int) Math.round(values.getOrDefault(Query.RESTART_COUNT, 0.0)),
        (int) Math.round(values.getOrDefault(Query.POD_COUNT, 0.0)));
  }

  static String escapeLabel(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}

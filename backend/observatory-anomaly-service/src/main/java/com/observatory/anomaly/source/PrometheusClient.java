package com.observatory.anomaly.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.observatory.anomaly.error.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal client for the Prometheus HTTP query API. "No data" is an empty result; transport
 * errors, timeouts, non-2xx answers and non-success payloads raise {@link SourceUnavailableException}.
 */
public class PrometheusClient {

  private static final Logger log = LoggerFactory.getLogger(PrometheusClient.class);

  private final RestClient http;
  private final ObjectMapper mapper;

  public PrometheusClient(RestClient http, ObjectMapper mapper) {
    this.http = http;
    this.mapper = mapper;
  }

  public Optional<Double> query(String expr) {
    JsonNode result = fetch("/api/v1/query?query={query}", Map.of("query", expr)).path("data").path("result");
    if (!result.isArray() || result.isEmpty()) {
      return Optional.empty();
    }
    return parseValue(result.get(0).path("value"));
  }

  public List<PromPoint> queryRange(String expr, Instant start, Instant end, Duration step) {
    Map<String, Object> vars = Map.of(
        "query", expr,
        "start", start.getEpochSecond(),
        "end", end.getEpochSecond(),
        "step", step.toSeconds() + "s");
    JsonNode result = fetch("/api/v1/query_range?query={query}&start={start}&end={end}&step={step}", vars)
        .path("data").path("result");
    if (!result.isArray() || result.isEmpty()) {
      return List.of();
    }
    List<PromPoint> points = new ArrayList<>();
    for (JsonNode pair : result.get(0).path("values")) {
      Optional<Double> value = parseValue(pair);
      if (value.isPresent()) {
        points.add(new PromPoint(Instant.ofEpochMilli(Math.round(pair.path(0).asDouble() * 1000.0)), value.get()));
      }
    }
    return points;
  }

  private JsonNode fetch(String uriTemplate, Map<String, ?> vars) {
    String body;
    try {
      body = http.get().uri(uriTemplate, vars).retrieve().body(String.class);
    } catch (RestClientException e) {
      throw new SourceUnavailableException("Prometheus request failed: " + e.getMessage(), e);
    }
    if (body == null || body.isBlank()) {
      throw new SourceUnavailableException("Prometheus returned an empty body");
    }
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new SourceUnavailableException("Prometheus returned malformed JSON", e);
    }
    String status = root.path("status").asText("");
    if (!"success".equals(status)) {
      throw new SourceUnavailableException("Prometheus query failed: " + root.path("error").asText(status));
    }
    return root;
  }

  // [ <unix seconds>, "<value>" ]; NaN and infinities count as no data
  private static Optional<Double> parseValue(JsonNode pair) {
    if (!pair.isArray() || pair.size() < 2) {
      return Optional.empty();
    }
    try {
      double value = Double.parseDouble(pair.get(1).asText());
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return Optional.empty();
      }
      return Optional.of(value);
    } catch (NumberFormatException e) {
      log.debug("[query] Unparseable sample value {}", pair.get(1));
      return Optional.empty();
    }
  }
}

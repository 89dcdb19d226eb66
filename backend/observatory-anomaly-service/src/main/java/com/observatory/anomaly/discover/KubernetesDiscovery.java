package com.observatory.anomaly.discover;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.observatory.anomaly.error.DiscoveryUnavailableException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Pods from the Kubernetes core API, registered as {@code k8s-<namespace>-<pod name>}.
 */
public class KubernetesDiscovery implements WorkloadDiscovery {

  static final String NAME_PREFIX = "k8s-";

  private final RestClient http;
  private final ObjectMapper mapper;
  private final List<String> namespaces;

  public KubernetesDiscovery(RestClient http, ObjectMapper mapper, List<String> namespaces) {
    this.http = http;
    this.mapper = mapper;
    this.namespaces = List.copyOf(namespaces);
  }

  @Override
  public String platform() {
    return "kubernetes";
  }

  /** Pods of every configured namespace. */
  @Override
  public List<DiscoveredWorkload> discover() {
    List<DiscoveredWorkload> out = new ArrayList<>();
    for (String namespace : namespaces) {
      out.addAll(discoverPods(namespace));
    }
    return out;
  }

  public List<DiscoveredWorkload> discoverPods(String namespace) {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace is required");
    }
    String body;
    try {
      body = http.get().uri("/api/v1/namespaces/{namespace}/pods", namespace).retrieve().body(String.class);
    } catch (RestClientException e) {
      throw new DiscoveryUnavailableException("Kubernetes request failed for namespace " + namespace + ": "
          + e.getMessage(), e);
    }
    JsonNode items;
    try {
      items = mapper.readTree(body == null ? "" : body).path("items");
    } catch (JsonProcessingException e) {
      throw new DiscoveryUnavailableException("Kubernetes returned malformed JSON", e);
    }
    if (!items.isArray()) {
      throw new DiscoveryUnavailableException("Kubernetes returned no pod list for namespace " + namespace);
    }

    List<DiscoveredWorkload> out = new ArrayList<>();
    for (JsonNode pod : items) {
      String name = pod.path("metadata").path("name").asText("");
      if (name.isEmpty()) continue;
      out.add(new DiscoveredWorkload(NAME_PREFIX + namespace + "-" + name, DiscoveredWorkload.KUBERNETES_POD,
          pod.path("status").path("phase").asText("Unknown")));
    }
    return out;
  }
}

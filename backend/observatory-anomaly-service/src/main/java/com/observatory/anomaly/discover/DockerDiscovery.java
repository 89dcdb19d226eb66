package com.observatory.anomaly.discover;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.observatory.anomaly.error.DiscoveryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Running containers from the Docker Engine API ({@code GET /containers/json}), registered as
 * {@code docker-<container name>}.
 */
public class DockerDiscovery implements WorkloadDiscovery {

  private static final Logger log = LoggerFactory.getLogger(DockerDiscovery.class);

  static final String NAME_PREFIX = "docker-";

  private final RestClient http;
  private final ObjectMapper mapper;

  public DockerDiscovery(RestClient http, ObjectMapper mapper) {
    this.http = http;
    this.mapper = mapper;
  }

  @Override
  public String platform() {
    return "docker";
  }

  @Override
  public List<DiscoveredWorkload> discover() {
    String body;
    try {
      body = http.get().uri("/containers/json").retrieve().body(String.class);
    } catch (RestClientException e) {
      throw new DiscoveryUnavailableException("Docker request failed: " + e.getMessage(), e);
    }
    JsonNode containers;
    try {
      containers = mapper.readTree(body == null ? "" : body);
    } catch (JsonProcessingException e) {
      throw new DiscoveryUnavailableException("Docker returned malformed JSON", e);
    }
    if (containers == null || !containers.isArray()) {
      throw new DiscoveryUnavailableException("Docker returned no container list");
    }

    List<DiscoveredWorkload> out = new ArrayList<>();
    for (JsonNode container : containers) {
      String name = containerName(container);
      if (name.isEmpty()) {
        log.debug("[discover] Skipping unnamed container {}", container.path("Id").asText());
        continue;
      }
      out.add(new DiscoveredWorkload(NAME_PREFIX + name, DiscoveredWorkload.DOCKER_CONTAINER,
          container.path("State").asText("unknown")));
    }
    return out;
  }

  // Names come back as ["/web"]; the first one is the container's own name
  private static String containerName(JsonNode container) {
    JsonNode names = container.path("Names");
    if (!names.isArray() || names.isEmpty()) {
      return "";
    }
    String name = names.get(0).asText("");
    return name.startsWith("/") ? name.substring(1) : name;
  }
}

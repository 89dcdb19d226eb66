package com.observatory.anomaly.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Bound from {@code observatory.discovery.*}. Both platforms are off unless enabled.
 */
@ConfigurationProperties(prefix = "observatory.discovery")
public record DiscoveryProperties(Duration interval, Docker docker, Kubernetes kubernetes) {

  public DiscoveryProperties {
    interval = interval == null ? Duration.ofMinutes(5) : interval;
    docker = docker == null ? new Docker(null, null, null) : docker;
    kubernetes = kubernetes == null ? new Kubernetes(null, null, null, null, null) : kubernetes;
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("observatory.discovery.interval must be positive, got " + interval);
    }
  }

  /** Docker Engine API over TCP, e.g. a daemon started with {@code -H tcp://0.0.0.0:2375}. */
  public record Docker(Boolean enabled, String baseUrl, Duration timeout) {
    public Docker {
      enabled = enabled == null ? Boolean.FALSE : enabled;
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:2375" : baseUrl;
      timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
    }
  }

  public record Kubernetes(
      Boolean enabled,
      String baseUrl,
      List<String> namespaces,
      String tokenFile,
      Duration timeout
  ) {
    public Kubernetes {
      enabled = enabled == null ? Boolean.FALSE : enabled;
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://kubernetes.default.svc" : baseUrl;
      namespaces = namespaces == null || namespaces.isEmpty() ? List.of("default") : List.copyOf(namespaces);
      tokenFile = tokenFile == null ? "/var/run/secrets/kubernetes.io/serviceaccount/token" : tokenFile;
      timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
    }
  }
}

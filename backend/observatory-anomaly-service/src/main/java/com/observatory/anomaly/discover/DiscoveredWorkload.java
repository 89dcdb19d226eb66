package com.observatory.anomaly.discover;

/** A running container or pod, named the way it is registered as a service. */
public record DiscoveredWorkload(String serviceName, String serviceType, String state) {
  public static final String DOCKER_CONTAINER = "docker_container";
  public static final String KUBERNETES_POD = "kubernetes_pod";
}

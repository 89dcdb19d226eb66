package com.observatory.api.controller;

import com.observatory.anomaly.discover.DiscoveryReport;
import com.observatory.anomaly.discover.DiscoveryService;
import com.observatory.api.model.DiscoverRequest;
import com.observatory.api.model.DiscoveryResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DiscoveryController {
  private final DiscoveryService discovery;

  public DiscoveryController(DiscoveryService discovery) {
    this.discovery = discovery;
  }

  @PostMapping("/api/docker/discover")
  public DiscoveryResponse discoverContainers() {
    DiscoveryReport report = discovery.discoverContainers();
    return DiscoveryResponse.of(report, "Registered " + report.registeredCount() + " of " + report.discovered()
        + " containers as services");
  }

  @PostMapping("/api/k8s/discover")
  public DiscoveryResponse discoverPods(@RequestBody(required = false) DiscoverRequest request) {
    DiscoveryReport report = discovery.discoverPods(request == null ? null : request.namespace());
    return DiscoveryResponse.of(report, "Registered " + report.registeredCount() + " of " + report.discovered()
        + " pods from namespace " + report.scope() + " as services");
  }
}

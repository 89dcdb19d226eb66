package com.observatory.api.controller;

import com.observatory.anomaly.service.MonitoringService;
import com.observatory.api.model.CollectResponse;
import com.observatory.api.model.HistoryResponse;
import com.observatory.api.model.MetricPoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
public class MetricsController {
  private final MonitoringService monitoring;

  public MetricsController(MonitoringService monitoring) {
    this.monitoring = monitoring;
  }

  @GetMapping("/api/metrics/history")
  public HistoryResponse history(
      @RequestParam(name = "service") String service,
      @RequestParam(name = "hours", defaultValue = "1") int hours
  ) {
    Instant since = Instant.now().minus(Duration.ofHours(HealthController.checkHours(hours)));
    List<MetricPoint> points = monitoring.history(service, since).stream().map(MetricPoint::of).toList();
    return new HistoryResponse(service, hours, points);
  }

  @PostMapping("/api/collect/{service}")
  public CollectResponse collect(@PathVariable("service") String service) {
    return CollectResponse.of(monitoring.collectNow(service));
  }
}

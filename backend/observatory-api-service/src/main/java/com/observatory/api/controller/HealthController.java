package com.observatory.api.controller;

import com.observatory.anomaly.model.ServiceHealth;
import com.observatory.anomaly.service.MonitoringService;
import com.observatory.api.model.AnomaliesResponse;
import com.observatory.api.model.AnomalyView;
import com.observatory.api.model.HealthSummaryResponse;
import com.observatory.api.model.HealthView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RestController
public class HealthController {
  static final int MAX_HOURS = 24 * 30;

  private final MonitoringService monitoring;

  public HealthController(MonitoringService monitoring) {
    this.monitoring = monitoring;
  }

  @GetMapping("/api/health/summary")
  public ResponseEntity<HealthSummaryResponse> summary(@RequestParam(name = "service", required = false) String service) {
    if (service == null || service.isBlank()) {
      List<HealthView> all = monitoring.healthSummary().stream().map(HealthView::of).toList();
      return ResponseEntity.ok(new HealthSummaryResponse(all, Instant.now()));
    }
    Optional<ServiceHealth> health = monitoring.serviceHealth(service);
    return health
        .map(h -> ResponseEntity.ok(new HealthSummaryResponse(List.of(HealthView.of(h)), Instant.now())))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/api/health/anomalies")
  public AnomaliesResponse anomalies(
      @RequestParam(name = "service", required = false) String service,
      @RequestParam(name = "hours", defaultValue = "24") int hours
  ) {
    Instant since = Instant.now().minus(Duration.ofHours(checkHours(hours)));
    List<AnomalyView> rows = monitoring.anomalies(blankToNull(service), since, null).stream()
        .map(AnomalyView::of)
        .toList();
    return new AnomaliesResponse(rows, rows.size(), hours);
  }

  static int checkHours(int hours) {
    if (hours < 1 || hours > MAX_HOURS) {
      throw new IllegalArgumentException("hours must be between 1 and " + MAX_HOURS + ", got " + hours);
    }
    return hours;
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}

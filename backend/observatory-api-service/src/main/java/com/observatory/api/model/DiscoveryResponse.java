package com.observatory.api.model;

import com.observatory.anomaly.discover.DiscoveryReport;

import java.util.List;

public record DiscoveryResponse(
    boolean success,
    String platform,
    String scope,
    int discovered,
    int registered,
    List<String> services,
    String message
) {
  public static DiscoveryResponse of(DiscoveryReport report, String message) {
    return new DiscoveryResponse(true, report.platform(), report.scope(), report.discovered(),
        report.registeredCount(), report.registered(), message);
  }
}

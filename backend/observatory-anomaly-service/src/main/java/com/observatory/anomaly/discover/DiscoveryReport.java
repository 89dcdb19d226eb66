package com.observatory.anomaly.discover;

import java.util.List;

public record DiscoveryReport(String platform, String scope, int discovered, List<String> registered) {
  public int registeredCount() {
    return registered.size();
  }
}

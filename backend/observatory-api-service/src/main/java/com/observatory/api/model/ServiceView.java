package com.observatory.api.model;

import com.observatory.anomaly.model.ServiceRegistration;

import java.time.Instant;

public record ServiceView(String serviceName, String serviceType, String status, Instant firstSeen, Instant lastSeen) {
  public static ServiceView of(ServiceRegistration r) {
    return new ServiceView(r.serviceName(), r.serviceType(), r.status(), r.firstSeen(), r.lastSeen());
  }
}

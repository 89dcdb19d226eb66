package com.observatory.api.model;

import com.observatory.anomaly.model.CollectionResult;

import java.time.Instant;
import java.util.Locale;

public record CollectResponse(
    boolean success,
    String serviceName,
    String outcome,
    Instant timestamp,
    boolean anomalyDetected,
    AnomalyView anomaly,
    Integer healthScore,
    String detail
) {
  public static CollectResponse of(CollectionResult r) {
    boolean success = r.outcome() == CollectionResult.Outcome.STORED || r.outcome() == CollectionResult.Outcome.DUPLICATE;
    return new CollectResponse(
        success,
        r.serviceName(),
        r.outcome().name().toLowerCase(Locale.ROOT),
        r.sample() == null ? null : r.sample().timestamp(),
        r.anomalyDetected(),
        r.anomaly() == null ? null : AnomalyView.of(r.anomaly()),
        r.health() == null ? null : r.health().score(),
        r.detail());
  }
}

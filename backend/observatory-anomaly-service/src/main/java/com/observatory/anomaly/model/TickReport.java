package com.observatory.anomaly.model;

import java.time.Duration;
import java.time.Instant;

public record TickReport(
    Instant startedAt,
    int services,
    int stored,
    int duplicates,
    int noData,
    int failed,
    int anomalies,
    Duration elapsed
) {}

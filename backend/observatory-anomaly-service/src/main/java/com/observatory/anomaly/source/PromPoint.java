package com.observatory.anomaly.source;

import java.time.Instant;

public record PromPoint(Instant timestamp, double value) {}

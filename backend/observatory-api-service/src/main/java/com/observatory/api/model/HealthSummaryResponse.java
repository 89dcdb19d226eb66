package com.observatory.api.model;

import java.time.Instant;
import java.util.List;

public record HealthSummaryResponse(List<HealthView> services, Instant generatedAt) {}

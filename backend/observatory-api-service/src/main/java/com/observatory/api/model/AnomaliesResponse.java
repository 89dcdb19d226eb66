package com.observatory.api.model;

import java.util.List;

public record AnomaliesResponse(List<AnomalyView> anomalies, int count, int hours) {}

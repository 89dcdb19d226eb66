package com.observatory.api.model;

import java.util.List;

public record HistoryResponse(String serviceName, int hours, List<MetricPoint> history) {}

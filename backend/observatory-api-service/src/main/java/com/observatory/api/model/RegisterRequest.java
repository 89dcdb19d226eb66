package com.observatory.api.model;

public record RegisterRequest(String serviceName, String serviceType, Boolean backfill) {}

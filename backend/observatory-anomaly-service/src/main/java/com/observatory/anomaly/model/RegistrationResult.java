package com.observatory.anomaly.model;

public record RegistrationResult(ServiceRegistration registration, boolean created, int backfilled) {}

package com.observatory.api.model;

public record RegisterResponse(boolean success, boolean created, ServiceView service, int backfilled, String message) {}

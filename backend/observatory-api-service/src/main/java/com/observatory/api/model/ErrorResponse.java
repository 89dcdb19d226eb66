package com.observatory.api.model;

public record ErrorResponse(String error, String message) {}

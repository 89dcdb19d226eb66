package com.observatory.api.model;

public record DiscoverRequest(String namespace) {}

package com.observatory.api.model;

import java.util.List;

public record ServicesResponse(List<ServiceView> services, int count) {}

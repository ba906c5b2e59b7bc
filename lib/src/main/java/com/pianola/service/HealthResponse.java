package com.pianola.service;

import java.util.List;

public record HealthResponse(
        String status,
        String backend,
        String architecture,
        List<String> features,
        int activeWorkers) {

    public HealthResponse {
        features = List.copyOf(features);
    }
}

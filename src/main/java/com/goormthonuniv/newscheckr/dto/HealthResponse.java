package com.goormthonuniv.newscheckr.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"status", "service", "version", "modelsLoaded", "modelVersion", "vocabularySize",
        "sourceCount", "summaryStrategies"})
public record HealthResponse(
        String status,                  // "UP"
        String service,
        String version,
        boolean modelsLoaded,
        String modelVersion,
        int vocabularySize,
        int sourceCount,
        List<String> summaryStrategies  // 시도 순서
) {}

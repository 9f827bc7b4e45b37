package com.goormthonuniv.newscheckr.dto;

import jakarta.validation.constraints.NotBlank;

public record AnalyzeUrlRequest(
        @NotBlank String url        // http/https 기사 링크
) {}

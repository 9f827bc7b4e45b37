package com.goormthonuniv.newscheckr.dto;

import jakarta.validation.constraints.NotBlank;

public record AnalyzeTextRequest(
        @NotBlank String text,      // 기사 본문
        String source               // 선택: 출처 도메인 (예: "reuters.com")
) {}

package com.goormthonuniv.newscheckr.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record ErrorResponse(
        String error,       // ErrorCode 이름
        String reason,      // 세부 사유 (예: "paywalled"), 없으면 null
        String message
) {}

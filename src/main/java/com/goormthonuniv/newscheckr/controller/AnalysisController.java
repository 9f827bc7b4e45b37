package com.goormthonuniv.newscheckr.controller;

import com.goormthonuniv.newscheckr.domain.AnalysisResult;
import com.goormthonuniv.newscheckr.domain.SourceRating;
import com.goormthonuniv.newscheckr.dto.AnalyzeTextRequest;
import com.goormthonuniv.newscheckr.dto.AnalyzeUrlRequest;
import com.goormthonuniv.newscheckr.dto.HealthResponse;
import com.goormthonuniv.newscheckr.service.AnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisOrchestrator orchestrator;

    @Operation(summary = "기사 URL 분석", description = "기사 URL을 전달하면 신뢰도 점수/정치 성향/요약/라벨을 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분석 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 URL"),
            @ApiResponse(responseCode = "422", description = "페이월/본문 없음"),
            @ApiResponse(responseCode = "502", description = "기사 서버 접근 실패"),
            @ApiResponse(responseCode = "504", description = "스크래핑 시간 초과")
    })
    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResult> analyze(@Valid @RequestBody AnalyzeUrlRequest req) {
        return ResponseEntity.ok(orchestrator.analyzeUrl(req.url()));
    }

    @Operation(summary = "기사 본문 분석", description = "본문 텍스트(선택: 출처 도메인)를 직접 분석합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분석 성공"),
            @ApiResponse(responseCode = "400", description = "빈 텍스트 또는 길이 초과")
    })
    @PostMapping("/analyze/text")
    public ResponseEntity<AnalysisResult> analyzeText(@Valid @RequestBody AnalyzeTextRequest req) {
        return ResponseEntity.ok(orchestrator.analyzeText(req.text(), req.source()));
    }

    @Operation(summary = "출처 평판 목록", description = "등록된 언론사 도메인별 평판 점수와 알려진 성향 (도메인 오름차순)")
    @GetMapping("/sources")
    public ResponseEntity<List<SourceRating>> sources() {
        return ResponseEntity.ok(orchestrator.listSources());
    }

    @Operation(summary = "헬스 체크", description = "모델 로딩 상태와 어휘 크기")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(orchestrator.health());
    }
}

package com.goormthonuniv.newscheckr.exception;

import com.goormthonuniv.newscheckr.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<ErrorResponse> handleAnalysis(AnalysisException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.warn("{} -> {}: {}", e.getErrorCode(), status.value(), e.getMessage());
        } else {
            log.debug("{} -> {}: {}", e.getErrorCode(), status.value(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getErrorCode().name(), e.getReason(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCode.INPUT_ERROR.name(), null, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCode.INPUT_ERROR.name(), null, "malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ErrorCode.INTERNAL_ERROR.name(), null, e.getMessage()));
    }

    /** 회복 불가능한 스크래핑 실패(페이월, 본문 없음, 잘못된 URL)는 422 */
    static HttpStatus statusOf(AnalysisException e) {
        if (e instanceof ScrapeException se && !se.getFailureReason().isTransient()) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return e.getErrorCode().status();
    }
}

package com.example.autolist.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 예외를 {error, code} 형태의 응답으로 변환
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("요청 값이 올바르지 않습니다.");
        return body(HttpStatus.BAD_REQUEST, message, "VALIDATION_ERROR");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getHeaderName() + " 헤더가 필요합니다.", "VALIDATION_ERROR");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleMissingParameter(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), "VALIDATION_ERROR");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("잘못된 요청: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), "VALIDATION_ERROR");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex) {
        log.warn("허용되지 않는 상태 전이: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, ex.getMessage(), "INVALID_STATE");
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getMessage(), "NOT_FOUND");
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConflictException ex) {
        log.warn("중복 게시 요청 차단: idempotencyKey={}", ex.getIdempotencyKey());
        return body(HttpStatus.CONFLICT, ex.getMessage(), "IDEMPOTENCY_CONFLICT");
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidToken(InvalidTokenException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_TOKEN");
    }

    @ExceptionHandler(ExpiredTokenException.class)
    public ResponseEntity<Map<String, Object>> handleExpiredToken(ExpiredTokenException ex) {
        return body(HttpStatus.GONE, ex.getMessage(), "TOKEN_EXPIRED");
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<Map<String, Object>> handleQuota(QuotaExceededException ex) {
        return body(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), "QUOTA_EXCEEDED");
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<Map<String, Object>> handleExternal(ExternalServiceException ex) {
        log.error("외부 서비스 호출 실패", ex);
        return body(HttpStatus.BAD_GATEWAY, ex.getMessage(), "EXTERNAL_SERVICE_ERROR");
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        log.error("저장소 오류", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "STORAGE_ERROR");
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(TaskRejectedException ex) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, "작업 큐가 가득 찼습니다. 잠시 후 다시 시도하세요.", "JOB_QUEUE_FULL");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("처리되지 않은 오류", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "요청 처리 중 오류가 발생했습니다: " + ex.getMessage(), "INTERNAL_ERROR");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String code) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("code", code);
        return ResponseEntity.status(status).body(response);
    }
}

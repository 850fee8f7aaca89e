package com.delta.mailverify.api;

import com.delta.mailverify.pipeline.service.InvalidPipelineRequestException;
import com.delta.mailverify.pipeline.service.TenantQuotaExceededException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {

  @ExceptionHandler(TenantQuotaExceededException.class)
  public ResponseEntity<Map<String, String>> handleQuota(TenantQuotaExceededException ex) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .body(Map.of("error", "tenant_quota_exceeded", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidPipelineRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalid(InvalidPipelineRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
  }
}

package com.ecvi.riskengine.verify.api;

import com.ecvi.riskengine.verify.service.ActiveVerificationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class VerificationExceptionHandler {

  @ExceptionHandler(ActiveVerificationException.class)
  public ResponseEntity<Map<String, Object>> handleActiveVerification(ActiveVerificationException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "active_verification");
    body.put("message", ex.getMessage());
    body.put("companyId", ex.getCompanyId());
    if (ex.getActiveRecordId() != null) {
      body.put("activeRecordId", ex.getActiveRecordId());
    }
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}

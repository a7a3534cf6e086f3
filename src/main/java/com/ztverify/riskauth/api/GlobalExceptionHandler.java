package com.ztverify.riskauth.api;

import com.ztverify.riskauth.domain.otp.RemainingTime;
import com.ztverify.riskauth.exception.AccountNotActiveException;
import com.ztverify.riskauth.exception.ChallengeAlreadyActiveException;
import com.ztverify.riskauth.exception.InvalidCredentialsException;
import com.ztverify.riskauth.exception.MalformedCodeException;
import com.ztverify.riskauth.exception.NotifierUnavailableException;
import com.ztverify.riskauth.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain failures to HTTP responses. Credential failures share one body so callers cannot
 * tell an unknown account from a wrong secret or an inactive account.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({InvalidCredentialsException.class, AccountNotActiveException.class})
    public ResponseEntity<?> handleCredentials(RuntimeException e) {
        log.warn("Credential failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(
                "error", "invalid_credentials",
                "message", "Invalid username or password"));
    }

    @ExceptionHandler({StorageUnavailableException.class, DataAccessException.class})
    public ResponseEntity<?> handleStorage(RuntimeException e) {
        log.error("Storage unavailable: {}", e.getMessage(), e);
        return unavailable();
    }

    @ExceptionHandler(NotifierUnavailableException.class)
    public ResponseEntity<?> handleNotifier(NotifierUnavailableException e) {
        log.error("Verification code delivery failed: {}", e.getMessage(), e);
        return unavailable();
    }

    @ExceptionHandler(MalformedCodeException.class)
    public ResponseEntity<?> handleMalformed(MalformedCodeException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "malformed_code",
                "message", e.getMessage()));
    }

    @ExceptionHandler(ChallengeAlreadyActiveException.class)
    public ResponseEntity<?> handleAlreadyActive(ChallengeAlreadyActiveException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(Map.of(
                "error", "challenge_active",
                "message", "A verification code was already sent. Please wait "
                        + RemainingTime.format(e.getRemainingSeconds()) + " before requesting another.",
                "remainingSeconds", e.getRemainingSeconds()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(err -> fields.putIfAbsent(err.getField(), err.getDefaultMessage()));
        return ResponseEntity.badRequest().body(Map.of(
                "error", "validation_failed",
                "fields", fields));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "malformed_request",
                "message", "Request body could not be parsed"));
    }

    private ResponseEntity<?> unavailable() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "error", "service_unavailable",
                "message", "The service is temporarily unavailable. Please try again later."));
    }
}

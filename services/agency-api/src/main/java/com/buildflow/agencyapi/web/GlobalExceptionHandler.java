package com.buildflow.agencyapi.web;

import com.buildflow.agencyapi.config.ServiceProperties;
import com.buildflow.database.agency.AgencyNotFoundException;
import com.buildflow.database.error.TenantDatabaseException;
import com.buildflow.observability.CorrelationContextHolder;
import com.buildflow.security.AuthenticationException;
import com.buildflow.security.AuthorizationException;
import com.buildflow.security.ErrorCode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to the {@link ErrorResponse} envelope with a stable {@link ErrorCode}.
 *
 * <p>In production ({@code buildflow.service.environment=production}) the {@code details} block
 * and any exception text are left out.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "5";

    private final ServiceProperties serviceProperties;

    public GlobalExceptionHandler(ServiceProperties serviceProperties) {
        this.serviceProperties = serviceProperties;
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationException ex) {
        log.info("Authentication failed: {}", ex.errorCode());
        return respond(ex.errorCode(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException ex) {
        // denials are audit-logged where they are decided
        return respond(ex.errorCode(), ex.getMessage(), ex.details());
    }

    @ExceptionHandler(AgencyNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAgencyNotFound(AgencyNotFoundException ex) {
        log.info("Agency lookup failed: {}", ex.getMessage());
        return respond(ErrorCode.AGENCY_NOT_FOUND, ErrorCode.AGENCY_NOT_FOUND.defaultMessage(), Map.of());
    }

    @ExceptionHandler(TenantDatabaseException.class)
    public ResponseEntity<ErrorResponse> handleDatabase(TenantDatabaseException ex) {
        ErrorCode code = ErrorCode.forDatabaseError(ex.kind());
        if (code.httpStatus() >= 500) {
            log.error("Database failure [{}] on {}", ex.kind(), ex.databaseName(), ex);
        } else {
            log.warn("Database request rejected [{}] on {}: {}", ex.kind(), ex.databaseName(), ex.getMessage());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", ex.kind().name());
        if (ex.databaseName() != null) {
            details.put("database", ex.databaseName());
        }
        ResponseEntity<ErrorResponse> response = respond(code, code.defaultMessage(), details);
        if (code.httpStatus() == 503) {
            return ResponseEntity.status(response.getStatusCode())
                    .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                    .body(response.getBody());
        }
        return response;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(fe -> fields.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
        log.warn("Validation failed: {}", fields.keySet());
        return respond(
                ErrorCode.VALIDATION_FAILED,
                ErrorCode.VALIDATION_FAILED.defaultMessage(),
                Map.of("fields", fields));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(ErrorCode.VALIDATION_FAILED, "Malformed request body", Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String message =
                serviceProperties.isProduction() || ex.getMessage() == null
                        ? ErrorCode.VALIDATION_FAILED.defaultMessage()
                        : ex.getMessage();
        return respond(ErrorCode.VALIDATION_FAILED, message, Map.of());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoRoute(NoResourceFoundException ex) {
        return respond(ErrorCode.ROUTE_NOT_FOUND, ErrorCode.ROUTE_NOT_FOUND.defaultMessage(), Map.of());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex) {
        return respond(
                ErrorCode.METHOD_NOT_ALLOWED, ErrorCode.METHOD_NOT_ALLOWED.defaultMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return respond(
                ErrorCode.INTERNAL_ERROR,
                ErrorCode.INTERNAL_ERROR.defaultMessage(),
                Map.of("exception", ex.getClass().getSimpleName(), "reason", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<ErrorResponse> respond(
            ErrorCode code, String message, Map<String, Object> details) {
        Map<String, Object> visibleDetails = serviceProperties.isProduction() ? null : details;
        return ResponseEntity.status(code.httpStatus())
                .body(
                        ErrorResponse.of(
                                code, message, visibleDetails, CorrelationContextHolder.currentCorrelationId()));
    }
}

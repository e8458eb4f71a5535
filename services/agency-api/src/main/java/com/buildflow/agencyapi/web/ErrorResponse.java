package com.buildflow.agencyapi.web;

import com.buildflow.security.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Error envelope shared by every failure the API returns:
 *
 * <pre>
 * {
 *   "success": false,
 *   "error": { "code": "RBAC_FORBIDDEN", "message": "Insufficient permissions", "details": {...} },
 *   "message": "Insufficient permissions",
 *   "correlationId": "0b6c..."
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(boolean success, Error error, String message, String correlationId) {

    /** @param details omitted when empty or hidden in production */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Error(String code, String message, Map<String, Object> details) {}

    public static ErrorResponse of(
            ErrorCode code, String message, Map<String, Object> details, String correlationId) {
        return new ErrorResponse(
                false, new Error(code.name(), message, details), message, correlationId);
    }
}

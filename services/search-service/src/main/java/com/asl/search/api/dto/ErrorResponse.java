package com.asl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final boolean success = false;
    private final String code;
    private final String error;
    private final String requestId;
    private final List<FieldError> details;

    public ErrorResponse(String code, String error, String requestId) {
        this(code, error, requestId, null);
    }

    public ErrorResponse(String code, String error, String requestId, List<FieldError> details) {
        this.code = code;
        this.error = error;
        this.requestId = requestId;
        this.details = details;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getCode() {
        return code;
    }

    public String getError() {
        return error;
    }

    public String getRequestId() {
        return requestId;
    }

    public List<FieldError> getDetails() {
        return details;
    }

    public static class FieldError {
        private final String field;
        private final String message;

        public FieldError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }
    }
}

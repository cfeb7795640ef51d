package com.asl.search.service;

import com.asl.search.api.dto.ErrorResponse;
import java.util.List;

public class InvalidSearchRequestException extends RuntimeException {
    private final List<ErrorResponse.FieldError> fieldErrors;

    public InvalidSearchRequestException(String message) {
        this(message, List.of());
    }

    public InvalidSearchRequestException(String message, List<ErrorResponse.FieldError> fieldErrors) {
        super(message);
        this.fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    }

    public List<ErrorResponse.FieldError> getFieldErrors() {
        return fieldErrors;
    }
}

package com.jdc.foodgram.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private String field;
    private Map<String, List<String>> errors;
    private String errorId;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public ErrorResponse(String code, String message, String errorId) {
        this.code = code;
        this.message = message;
        this.errorId = errorId;
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse of(CustomException ex) {
        ErrorResponse response = new ErrorResponse(ex.getErrorCode().getCode(), ex.getMessage());
        response.field = ex.getField();
        return response;
    }

    public static ErrorResponse ofFieldErrors(Map<String, List<String>> errors) {
        ErrorResponse response = new ErrorResponse(
                ErrorCode.INVALID_INPUT_VALUE.getCode(), ErrorCode.INVALID_INPUT_VALUE.getMessage());
        response.errors = errors;
        return response;
    }
}

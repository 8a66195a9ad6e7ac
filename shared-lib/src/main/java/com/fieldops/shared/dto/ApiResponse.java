package com.fieldops.shared.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Uniform response envelope for every REST endpoint.
 *
 * Success: {"success": true, "data": {...}}
 * Failure: {"success": false, "errorCode": "SCHEDULE_BUSY", "message": "...", "retryable": true}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private String errorCode;
    private String message;
    private List<String> details;
    private Boolean retryable;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> ok(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(String code, String message) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorCode(code)
                .message(message)
                .build();
    }

    public static <T> ApiResponse<T> error(String code, String message, List<String> details, boolean retryable) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorCode(code)
                .message(message)
                .details(details)
                .retryable(retryable)
                .build();
    }
}

package com.measurelog.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Standardized API response wrapper shared by the ingestion and embedding services.
 * Failures carry a machine-readable {@code errorCode} next to the human-readable message.
 *
 * @param <T> the type of the response data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private String message;
    private String errorCode;
    private T data;
    private int status;
    private Instant timestamp;

    // Default constructor for Jackson deserialization
    public ApiResponse() {
        this.timestamp = Instant.now();
    }

    private ApiResponse(boolean success, String message, String errorCode, T data, int status) {
        this.success = success;
        this.message = message;
        this.errorCode = errorCode;
        this.data = data;
        this.status = status;
        this.timestamp = Instant.now();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Static Factory Methods
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    public static <T> ApiResponse<T> success(T data, String message) {
        return new ApiResponse<>(true, message, null, data, 200);
    }

    public static <T> ApiResponse<T> accepted(T data, String message) {
        return new ApiResponse<>(true, message, null, data, 202);
    }

    public static <T> ApiResponse<T> error(String message, String errorCode, int status) {
        return new ApiResponse<>(false, message, errorCode, null, status);
    }

    public static <T> ApiResponse<T> error(String message, int status) {
        return error(message, null, status);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Getters & Setters
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}

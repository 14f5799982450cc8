package com.factory.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {

    private final String code;      // Machine-readable error code
    private final String message;   // Fixed client-facing message
    private final String details;
    private final String requestId; // Echo of X-Request-ID, for correlating with server logs

    public ErrorInfo(String code, String message, String details, String requestId) {
        this.code = code;
        this.message = message;
        this.details = details;
        this.requestId = requestId;
    }

    public ErrorInfo(String code, String message, String requestId) {
        this(code, message, null, requestId);
    }

    public ErrorInfo(String code, String message) {
        this(code, message, null, null);
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getDetails() {
        return details;
    }

    public String getRequestId() {
        return requestId;
    }
}

package com.zzf.simon.api;

/**
 * Request-level failure with a stable machine code. Never retried by the server.
 */
public class ApiException extends RuntimeException {
    private final ErrorKind kind;
    private final String code;
    private final Long retryAfterSeconds;

    public ApiException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null);
    }

    public ApiException(ErrorKind kind, String code, String message, Long retryAfterSeconds) {
        super(message);
        this.kind = kind;
        this.code = code;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static ApiException validation(String code, String message) {
        return new ApiException(ErrorKind.VALIDATION, code, message);
    }

    public static ApiException forbidden(String code, String message) {
        return new ApiException(ErrorKind.FORBIDDEN, code, message);
    }

    public static ApiException notFound(String code, String message) {
        return new ApiException(ErrorKind.NOT_FOUND, code, message);
    }

    public static ApiException conflict(String code, String message) {
        return new ApiException(ErrorKind.CONFLICT, code, message);
    }

    public static ApiException rateLimited(String message, long retryAfterSeconds) {
        return new ApiException(ErrorKind.RATE_LIMITED, "RATE_LIMITED", message, retryAfterSeconds);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

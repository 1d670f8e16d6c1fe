package com.zzf.simon.api;

import com.zzf.simon.store.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public final class GlobalExceptionHandler {
    private static final String JSON_UTF8 = "application/json;charset=UTF-8";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException e) {
        if (e.getKind() == ErrorKind.INTERNAL) {
            log.error("api.error code={} msg={}", e.getCode(), e.getMessage(), e);
        } else {
            log.info("api.reject kind={} code={} msg={}", e.getKind(), e.getCode(), e.getMessage());
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getKind().status())
                .header(HttpHeaders.CONTENT_TYPE, JSON_UTF8);
        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        return builder.body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.info("api.reject kind=VALIDATION code=INVALID_REQUEST err={}", e.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .header(HttpHeaders.CONTENT_TYPE, JSON_UTF8)
                .body(new ErrorResponse("INVALID_REQUEST", "Invalid request body"));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreException(StoreException e) {
        log.error("store.failure code={} msg={}", e.getCode(), e.getMessage(), e);
        HttpStatus status = e.isTransient() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        String code = e.isTransient() ? "STORE_UNAVAILABLE" : "STORE_ERROR";
        return ResponseEntity.status(status)
                .header(HttpHeaders.CONTENT_TYPE, JSON_UTF8)
                .body(new ErrorResponse(code, "Storage operation failed"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknownException(Exception e) {
        String msg = e.getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            msg = e.getClass().getSimpleName();
        } else {
            msg = e.getClass().getSimpleName() + ": " + msg;
        }
        log.error("api.error code=INTERNAL_ERROR", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .header(HttpHeaders.CONTENT_TYPE, JSON_UTF8)
                .body(new ErrorResponse("INTERNAL_ERROR", msg));
    }
}

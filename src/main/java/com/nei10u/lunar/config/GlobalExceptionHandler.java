package com.nei10u.lunar.config;

import com.nei10u.lunar.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.DateTimeException;
import java.time.LocalDateTime;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class})
    public ResponseEntity<ErrorResponse> handleInvalidInput(RuntimeException e) {
        log.warn("invalid lunar query: {}", e.getMessage());
        return toResponse(HttpStatus.BAD_REQUEST, "INVALID_INPUT", e.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("bad request parameter: {}", e.getMessage());
        return toResponse(HttpStatus.BAD_REQUEST, "BAD_PARAMETER", e.getMessage());
    }

    /**
     * 未知路径（404）、方法不支持（405）等 Spring MVC 自带状态码的异常，保留原状态码。
     */
    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ErrorResponse> handleMvcStatus(ErrorResponseException e) {
        log.warn("mvc rejected request: {}", e.getMessage());
        return toResponse(e.getStatusCode(), "REQUEST_REJECTED", e.getBody().getDetail());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        log.warn("method not supported: {}", e.getMessage());
        return toResponse(e.getStatusCode(), "METHOD_NOT_ALLOWED", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("unexpected failure: {}", e.getMessage(), e);
        return toResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "服务内部错误");
    }

    private static ResponseEntity<ErrorResponse> toResponse(HttpStatusCode status, String code, String message) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.builder()
                        .status(status.value())
                        .code(code)
                        .message(message)
                        .timestamp(LocalDateTime.now())
                        .build());
    }
}

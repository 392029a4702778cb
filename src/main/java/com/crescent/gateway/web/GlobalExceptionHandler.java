package com.crescent.gateway.web;

import com.crescent.gateway.api.ErrorResponse;
import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.error.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * 统一错误信封 {@code {error: {message, type, code, param?}}}
 * <p>
 * 内部异常只记录日志，对外返回通用描述。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException e) {
        if (e.getKind() == GatewayErrorKind.INTERNAL_ERROR) {
            log.error("Internal gateway error", e.getCause() != null ? e.getCause() : e);
        }
        return toResponse(e);
    }

    /**
     * 请求体缺失或不是合法 JSON
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInputException(ServerWebInputException e) {
        log.debug("Malformed request body: {}", e.getMessage());
        return toResponse(GatewayException.badRequest("Request body is missing or is not valid JSON"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        GatewayErrorKind kind;
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            kind = GatewayErrorKind.NOT_FOUND;
        } else if (status.is4xxClientError()) {
            kind = GatewayErrorKind.BAD_REQUEST;
        } else {
            kind = GatewayErrorKind.INTERNAL_ERROR;
        }
        String message = e.getReason() != null ? e.getReason() : status.toString();
        GatewayException error = new GatewayException(kind, message,
                kind == GatewayErrorKind.NOT_FOUND ? "not_found" : null, null, e);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(error));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return toResponse(GatewayException.internal(e));
    }

    private static ResponseEntity<ErrorResponse> toResponse(GatewayException e) {
        return ResponseEntity.status(e.getKind().getStatus())
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(e));
    }
}

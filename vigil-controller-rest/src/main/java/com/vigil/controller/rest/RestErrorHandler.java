package com.vigil.controller.rest;

import com.vigil.service.core.error.DetectionException;
import com.vigil.service.core.error.DetectorUnavailableException;
import com.vigil.service.core.error.InvalidInputException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global REST exception mapper. Produces consistent JSON payloads for client-visible errors. */
@ControllerAdvice
@Slf4j
public class RestErrorHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorPayload> handleInvalidInput(InvalidInputException ex, WebRequest request) {
        log.warn("Rejected detection request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(DetectorUnavailableException.class)
    public ResponseEntity<ErrorPayload> handleUnavailable(DetectorUnavailableException ex, WebRequest request) {
        log.warn("Detection method unavailable method={}: {}", ex.getMethod(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, InvalidInputException.CODE, "Malformed JSON request body", request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorPayload> handleBadParameter(Exception ex, WebRequest request) {
        log.warn("Rejected request parameters: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, InvalidInputException.CODE, ex.getMessage(), request);
    }

    @ExceptionHandler(DetectionException.class)
    public ResponseEntity<ErrorPayload> handleDetection(DetectionException ex, WebRequest request) {
        log.error("Detection failed code={}", ex.getCode(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorPayload> handleUnexpected(Exception ex, WebRequest request) {
        log.error("Unhandled error serving {}", pathOf(request), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", "Internal server error", request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String code, String message, WebRequest request) {
        ErrorPayload body =
                new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), code, message, pathOf(request));
        return ResponseEntity.status(status).body(body);
    }

    private static String pathOf(WebRequest request) {
        if (request instanceof ServletWebRequest servletRequest) {
            return servletRequest.getRequest().getRequestURI();
        }
        return null;
    }
}

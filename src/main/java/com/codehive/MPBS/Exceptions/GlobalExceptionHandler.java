package com.codehive.MPBS.Exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Turns business-rule failures into problem responses. Bean validation errors on request
 * bodies are rendered by the base class as 400 problems.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @Override
    protected ResponseEntity<Object> handleErrorResponseException(ErrorResponseException ex, HttpHeaders headers,
            HttpStatusCode status, WebRequest request) {
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", ex.getBody().getDetail(), ex);
        } else if (ex instanceof ParkingException) {
            log.warn("Request rejected: code={}, detail={}", ((ParkingException) ex).getErrorCode(),
                    ex.getBody().getDetail());
        }
        return super.handleErrorResponseException(ex, headers, status, request);
    }
}

package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base type for business-rule failures. Each carries a problem body whose {@code errorCode}
 * property names the failure kind and whose detail is the message shown to the operator.
 */
public abstract class ParkingException extends ErrorResponseException {

    private final String errorCode;

    protected ParkingException(HttpStatus status, String errorCode, String title, String detail) {
        this(status, errorCode, title, detail, null);
    }

    protected ParkingException(HttpStatus status, String errorCode, String title, String detail, Throwable cause) {
        super(status, createProblem(status, errorCode, title, detail), cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String getMessage() {
        return getBody().getDetail();
    }

    private static ProblemDetail createProblem(HttpStatus status, String errorCode, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatus(status);
        problem.setTitle(title);
        problem.setDetail(detail);
        problem.setProperty("errorCode", errorCode);
        return problem;
    }
}

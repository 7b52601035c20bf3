package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

public class BillGenerationException extends ParkingException {

    public BillGenerationException(String reason, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "BILL_GENERATION_FAILED", "Bill generation failed",
                "Error generating bill: " + reason, cause);
    }
}

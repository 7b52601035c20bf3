package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

public class InvalidBookingException extends ParkingException {

    public InvalidBookingException(String detail) {
        super(HttpStatus.BAD_REQUEST, "INVALID_BOOKING", "Invalid booking request", detail);
    }
}

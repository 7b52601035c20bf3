package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

public class ProtectedResourceException extends ParkingException {

    public ProtectedResourceException(String detail) {
        super(HttpStatus.CONFLICT, "PROTECTED_RESOURCE", "Protected resource", detail);
    }
}

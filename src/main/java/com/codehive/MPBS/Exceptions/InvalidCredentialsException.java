package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

// Same message for unknown user and wrong password
public class InvalidCredentialsException extends ParkingException {

    public InvalidCredentialsException() {
        super(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Login failed", "Invalid username or password");
    }
}

package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

public class DuplicateUsernameException extends ParkingException {

    public DuplicateUsernameException(String username) {
        super(HttpStatus.CONFLICT, "DUPLICATE_USERNAME", "Username taken", "Username already exists!");
        getBody().setProperty("username", username);
    }
}

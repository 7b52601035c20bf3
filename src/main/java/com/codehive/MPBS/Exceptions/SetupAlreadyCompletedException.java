package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

public class SetupAlreadyCompletedException extends ParkingException {

    public SetupAlreadyCompletedException() {
        super(HttpStatus.CONFLICT, "SETUP_COMPLETED", "Setup already completed",
                "A primary admin already exists. Ask an admin to create your account.");
    }
}

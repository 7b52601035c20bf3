package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends ParkingException {

    public ResourceNotFoundException(String resourceType, Object id) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", resourceType + " not found",
                "No " + resourceType.toLowerCase() + " found with id " + id);
    }
}

package com.codehive.MPBS.Entities;

// Enum name is also the Spring Security authority
public enum Role {
    ADMIN,
    OPERATOR
}

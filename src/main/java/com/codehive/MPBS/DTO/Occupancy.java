package com.codehive.MPBS.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

// Slots rented for the current rental period; occupied + available == total
@Data
@AllArgsConstructor
public class Occupancy {
    private int occupied;
    private int available;
    private int total;
}

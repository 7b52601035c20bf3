package com.codehive.MPBS.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class BookingFormResponse {
    private List<String> slots;
    private List<String> years;
    private List<String> months;
    private int currentYear;
}

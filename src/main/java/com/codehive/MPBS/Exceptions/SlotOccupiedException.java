package com.codehive.MPBS.Exceptions;

import org.springframework.http.HttpStatus;

public class SlotOccupiedException extends ParkingException {

    private final String slotNumber;
    private final String month;
    private final String year;

    public SlotOccupiedException(String slotNumber, String month, String year) {
        super(HttpStatus.CONFLICT, "SLOT_OCCUPIED", "Slot already occupied",
                "Slot " + slotNumber + " is already occupied for " + month + " " + year + "!");
        this.slotNumber = slotNumber;
        this.month = month;
        this.year = year;
        getBody().setProperty("slotNumber", slotNumber);
        getBody().setProperty("month", month);
        getBody().setProperty("year", year);
    }

    public String getSlotNumber() {
        return slotNumber;
    }

    public String getMonth() {
        return month;
    }

    public String getYear() {
        return year;
    }
}

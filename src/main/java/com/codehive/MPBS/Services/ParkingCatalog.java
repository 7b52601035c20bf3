package com.codehive.MPBS.Services;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fixed reference data of the facility: its 14 slots, the selectable years and the month
 * names used as rental periods.
 */
@Component
public class ParkingCatalog {

    public static final int TOTAL_SLOTS = 14;
    public static final int FIRST_YEAR = 2020;
    public static final int LAST_YEAR = 2030;

    private static final List<String> SLOTS = IntStream.rangeClosed(1, TOTAL_SLOTS)
            .mapToObj(i -> String.format("SLOT-%02d", i))
            .collect(Collectors.toUnmodifiableList());

    private static final List<String> YEARS = IntStream.rangeClosed(FIRST_YEAR, LAST_YEAR)
            .mapToObj(String::valueOf)
            .collect(Collectors.toUnmodifiableList());

    private static final List<String> MONTHS = Arrays.stream(Month.values())
            .map(ParkingCatalog::displayName)
            .collect(Collectors.toUnmodifiableList());

    public List<String> getSlots() {
        return SLOTS;
    }

    public List<String> getYears() {
        return YEARS;
    }

    public List<String> getMonths() {
        return MONTHS;
    }

    public boolean isSlot(String slotNumber) {
        return SLOTS.contains(slotNumber);
    }

    public boolean isYear(String year) {
        return YEARS.contains(year);
    }

    // "january" and "JANUARY" both resolve to "January"
    public Optional<String> normalizeMonth(String month) {
        if (month == null) {
            return Optional.empty();
        }
        String trimmed = month.trim();
        return MONTHS.stream().filter(m -> m.equalsIgnoreCase(trimmed)).findFirst();
    }

    public String monthName(LocalDate date) {
        return displayName(date.getMonth());
    }

    // Calendar position of a canonical month name, 1 for January; 0 when unknown
    public int monthNumber(String month) {
        return MONTHS.indexOf(month) + 1;
    }

    private static String displayName(Month month) {
        return month.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}

package com.codehive.MPBS.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyReportEntry {
    private String month;
    private String year;
    private long count;
    private BigDecimal totalAmount;
}

package com.codehive.MPBS.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ReportsResponse {
    private List<MonthlyReportEntry> monthlyReports;
    private List<VehicleTypeStat> vehicleStats;
}

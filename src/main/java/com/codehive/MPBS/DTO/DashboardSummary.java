package com.codehive.MPBS.DTO;

import com.codehive.MPBS.Entities.ParkingBill;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class DashboardSummary {
    // Bills created this calendar month, whatever period they rent
    private long monthlyCount;
    private long totalBills;
    private List<ParkingBill> recentBills;
    private Occupancy occupancy;
}

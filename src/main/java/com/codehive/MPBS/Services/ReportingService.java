package com.codehive.MPBS.Services;

import com.codehive.MPBS.DTO.DashboardSummary;
import com.codehive.MPBS.DTO.MonthlyReportEntry;
import com.codehive.MPBS.DTO.Occupancy;
import com.codehive.MPBS.DTO.VehicleTypeStat;
import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Repositories.ParkingBillRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class ReportingService {

    @Autowired
    private MongoTemplate mongoTemplate;

    @Autowired
    private ParkingBillRepository parkingBillRepository;

    @Autowired
    private ParkingCatalog parkingCatalog;

    @Autowired
    private Clock clock;

    // Bill count and revenue per rental period, oldest period first
    public List<MonthlyReportEntry> monthlyReport() {
        Aggregation aggregation = Aggregation.newAggregation(
                // Step 1: One group per (month, year)
                Aggregation.group("month", "year")
                        .count().as("count")
                        .sum("amount").as("totalAmount"),

                // Step 2: Lift the group keys out of _id
                Aggregation.project("month", "year", "count", "totalAmount").andExclude("_id"));

        AggregationResults<MonthlyReportEntry> results = mongoTemplate.aggregate(aggregation, ParkingBill.class,
                MonthlyReportEntry.class);

        // Month names do not sort chronologically in the database, order them here
        List<MonthlyReportEntry> entries = new ArrayList<>(results.getMappedResults());
        entries.sort(Comparator.comparing(MonthlyReportEntry::getYear)
                .thenComparingInt(entry -> parkingCatalog.monthNumber(entry.getMonth())));
        return entries;
    }

    public List<VehicleTypeStat> vehicleTypeStats() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group("vehicleType").count().as("count"),
                Aggregation.project("count").and("_id").as("vehicleType").andExclude("_id"),
                Aggregation.sort(Sort.by(Sort.Direction.DESC, "count").and(Sort.by("vehicleType"))));

        AggregationResults<VehicleTypeStat> results = mongoTemplate.aggregate(aggregation, ParkingBill.class,
                VehicleTypeStat.class);
        return results.getMappedResults();
    }

    public Occupancy occupancy() {
        return occupancy(LocalDate.now(clock));
    }

    public Occupancy occupancy(LocalDate today) {
        Query query = new Query(Criteria.where("month").is(parkingCatalog.monthName(today))
                .and("year").is(String.valueOf(today.getYear())));

        List<String> rentedSlots = mongoTemplate.findDistinct(query, "slotNumber", ParkingBill.class, String.class);
        int occupied = (int) rentedSlots.stream().filter(parkingCatalog::isSlot).count();

        return new Occupancy(occupied, ParkingCatalog.TOTAL_SLOTS - occupied, ParkingCatalog.TOTAL_SLOTS);
    }

    public DashboardSummary dashboardSummary() {
        return dashboardSummary(LocalDate.now(clock));
    }

    public DashboardSummary dashboardSummary(LocalDate today) {
        // Creation date window, independent of the rental period used by occupancy
        LocalDateTime monthStart = today.withDayOfMonth(1).atStartOfDay();
        Query createdThisMonth = new Query(Criteria.where("billDate").gte(monthStart).lt(monthStart.plusMonths(1)));
        long monthlyCount = mongoTemplate.count(createdThisMonth, ParkingBill.class);

        return new DashboardSummary(
                monthlyCount,
                parkingBillRepository.count(),
                parkingBillRepository.findTop5ByOrderByBillDateDesc(),
                occupancy(today));
    }
}

package com.codehive.MPBS.Controller;

import com.codehive.MPBS.DTO.DashboardSummary;
import com.codehive.MPBS.Services.ReportingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    @Autowired
    private ReportingService reportingService;

    @GetMapping
    public ResponseEntity<DashboardSummary> getDashboard() {
        return ResponseEntity.ok(reportingService.dashboardSummary());
    }
}

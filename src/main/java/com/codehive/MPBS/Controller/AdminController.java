package com.codehive.MPBS.Controller;

import com.codehive.MPBS.DTO.AddUserRequestDTO;
import com.codehive.MPBS.DTO.MessageResponse;
import com.codehive.MPBS.DTO.ReportsResponse;
import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Entities.Users;
import com.codehive.MPBS.Services.AdminService;
import com.codehive.MPBS.Services.ReportingService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    @Autowired
    private AdminService adminService;

    @Autowired
    private ReportingService reportingService;

    // --- Bills ---
    @GetMapping("/bills")
    public ResponseEntity<Page<ParkingBill>> getBills(@RequestParam(defaultValue = "1") int page) {
        return ResponseEntity.ok(adminService.listBills(page));
    }

    // --- User Management ---
    @GetMapping("/users")
    public ResponseEntity<List<Users>> getAllUsers() {
        return ResponseEntity.ok(adminService.listUsers());
    }

    @PostMapping("/add_user")
    public ResponseEntity<Users> addUser(@Valid @RequestBody AddUserRequestDTO request) {
        Users user = adminService.addUser(request.getUsername(), request.getPassword(), request.getRole());
        return new ResponseEntity<>(user, HttpStatus.CREATED);
    }

    @RequestMapping(value = "/delete_user/{id}", method = { RequestMethod.GET, RequestMethod.DELETE })
    public ResponseEntity<MessageResponse> deleteUser(@PathVariable String id) {
        adminService.deleteUser(id);
        return ResponseEntity.ok(new MessageResponse("User deleted successfully!"));
    }

    // --- Reports ---
    @GetMapping("/reports")
    public ResponseEntity<ReportsResponse> getReports() {
        return ResponseEntity.ok(new ReportsResponse(
                reportingService.monthlyReport(),
                reportingService.vehicleTypeStats()));
    }
}

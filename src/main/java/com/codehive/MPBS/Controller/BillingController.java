package com.codehive.MPBS.Controller;

import com.codehive.MPBS.DTO.BillDocument;
import com.codehive.MPBS.DTO.BookingFormResponse;
import com.codehive.MPBS.DTO.BookingRequestDTO;
import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Services.AdminService;
import com.codehive.MPBS.Services.BillDocumentGenerator;
import com.codehive.MPBS.Services.BillingService;
import com.codehive.MPBS.Services.ParkingCatalog;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Year;
import java.util.List;

@RestController
@RequestMapping("/api")
public class BillingController {

    @Autowired
    private BillingService billingService;

    @Autowired
    private BillDocumentGenerator billDocumentGenerator;

    @Autowired
    private AdminService adminService;

    @Autowired
    private ParkingCatalog parkingCatalog;

    @Autowired
    private Clock clock;

    // Choices for the booking form
    @GetMapping({ "", "/" })
    public ResponseEntity<BookingFormResponse> bookingForm() {
        return ResponseEntity.ok(new BookingFormResponse(
                parkingCatalog.getSlots(),
                parkingCatalog.getYears(),
                parkingCatalog.getMonths(),
                Year.now(clock).getValue()));
    }

    @PostMapping("/generate")
    public ResponseEntity<byte[]> generateBill(@Valid @RequestBody BookingRequestDTO payload,
            Authentication authentication) {
        // The bill is stored before anything is rendered
        ParkingBill bill = billingService.createBill(payload, authentication.getName());
        return download(billDocumentGenerator.render(bill));
    }

    @GetMapping("/bills/{id}/pdf")
    public ResponseEntity<byte[]> downloadBill(@PathVariable Long id) {
        return download(billDocumentGenerator.render(billingService.findBill(id)));
    }

    @GetMapping("/search")
    public ResponseEntity<List<ParkingBill>> search(@RequestParam(name = "q", defaultValue = "") String query) {
        return ResponseEntity.ok(adminService.search(query));
    }

    private ResponseEntity<byte[]> download(BillDocument document) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(document.getFileName()).build().toString())
                .body(document.getContent());
    }
}

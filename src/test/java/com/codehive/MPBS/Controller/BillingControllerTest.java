package com.codehive.MPBS.Controller;

import com.codehive.MPBS.Config.ClockConfig;
import com.codehive.MPBS.Config.SecurityConfig;
import com.codehive.MPBS.DTO.BillDocument;
import com.codehive.MPBS.DTO.BookingRequestDTO;
import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Exceptions.InvalidBookingException;
import com.codehive.MPBS.Exceptions.ResourceNotFoundException;
import com.codehive.MPBS.Exceptions.SlotOccupiedException;
import com.codehive.MPBS.Repositories.UserRepository;
import com.codehive.MPBS.Services.AdminService;
import com.codehive.MPBS.Services.BillDocumentGenerator;
import com.codehive.MPBS.Services.BillingService;
import com.codehive.MPBS.Services.ParkingCatalog;
import com.codehive.MPBS.security.JwtUtils;
import com.codehive.MPBS.security.TokenDenylistService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BillingController.class)
@Import({ SecurityConfig.class, ParkingCatalog.class, ClockConfig.class })
public class BillingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private BillingService billingService;

    @MockBean
    private BillDocumentGenerator billDocumentGenerator;

    @MockBean
    private AdminService adminService;

    @MockBean
    private UserRepository userRepository;

    @MockBean
    private JwtUtils jwtUtils;

    @MockBean
    private TokenDenylistService tokenDenylistService;

    private static BookingRequestDTO aliceRequest() {
        return BookingRequestDTO.builder()
                .customerName("Alice")
                .vehicleNumber("TN10AB1234")
                .vehicleType("Car")
                .slotNumber("SLOT-01")
                .month("January")
                .year("2025")
                .paymentMode("Cash")
                .build();
    }

    @Test
    void bookingForm_RequiresLogin() throws Exception {
        mockMvc.perform(get("/api/"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(username = "operator1", authorities = "OPERATOR")
    void bookingForm_ListsCatalog() throws Exception {
        mockMvc.perform(get("/api/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slots.length()").value(14))
                .andExpect(jsonPath("$.slots[0]").value("SLOT-01"))
                .andExpect(jsonPath("$.slots[13]").value("SLOT-14"))
                .andExpect(jsonPath("$.years[0]").value("2020"))
                .andExpect(jsonPath("$.years[10]").value("2030"))
                .andExpect(jsonPath("$.months[0]").value("January"))
                .andExpect(jsonPath("$.currentYear").isNumber());
    }

    @Test
    @WithMockUser(username = "admin", authorities = "ADMIN")
    void generate_ReturnsPdfAttachment() throws Exception {
        // Arrange
        ParkingBill bill = new ParkingBill();
        bill.setId(1L);
        byte[] pdf = "%PDF-1.4".getBytes();
        when(billingService.createBill(any(BookingRequestDTO.class), eq("admin"))).thenReturn(bill);
        when(billDocumentGenerator.render(bill))
                .thenReturn(new BillDocument("Parking_Bill_Alice_January_2025_1.pdf", pdf));

        // Act & Assert
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(aliceRequest())))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"Parking_Bill_Alice_January_2025_1.pdf\""))
                .andExpect(content().bytes(pdf));
    }

    @Test
    @WithMockUser(username = "admin", authorities = "ADMIN")
    void generate_SlotOccupied_ReturnsConflict() throws Exception {
        when(billingService.createBill(any(BookingRequestDTO.class), eq("admin")))
                .thenThrow(new SlotOccupiedException("SLOT-01", "January", "2025"));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(aliceRequest())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("SLOT_OCCUPIED"))
                .andExpect(jsonPath("$.detail").value("Slot SLOT-01 is already occupied for January 2025!"))
                .andExpect(jsonPath("$.slotNumber").value("SLOT-01"));

        verifyNoInteractions(billDocumentGenerator);
    }

    @Test
    @WithMockUser(username = "admin", authorities = "ADMIN")
    void generate_MissingField_ReturnsBadRequest() throws Exception {
        BookingRequestDTO request = aliceRequest();
        request.setCustomerName("");

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(billingService);
    }

    @Test
    @WithMockUser(username = "admin", authorities = "ADMIN")
    void generate_UnknownSlot_ReturnsBadRequest() throws Exception {
        when(billingService.createBill(any(BookingRequestDTO.class), eq("admin")))
                .thenThrow(new InvalidBookingException("Unknown parking slot: SLOT-15"));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(aliceRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_BOOKING"));
    }

    @Test
    @WithMockUser(username = "operator1", authorities = "OPERATOR")
    void downloadBill_Missing_ReturnsNotFound() throws Exception {
        when(billingService.findBill(42L)).thenThrow(new ResourceNotFoundException("Bill", 42L));

        mockMvc.perform(get("/api/bills/42/pdf"))
                .andExpect(status().isNotFound());
    }

    @Test
    @WithMockUser(username = "operator1", authorities = "OPERATOR")
    void search_DelegatesQuery() throws Exception {
        ParkingBill bill = new ParkingBill();
        bill.setId(3L);
        bill.setCustomerName("Alice");
        when(adminService.search("ali")).thenReturn(List.of(bill));

        mockMvc.perform(get("/api/search").param("q", "ali"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].customerName").value("Alice"));
    }

    @Test
    @WithMockUser(username = "operator1", authorities = "OPERATOR")
    void search_WithoutQuery_ReturnsEmptyList() throws Exception {
        when(adminService.search("")).thenReturn(List.of());

        mockMvc.perform(get("/api/search"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}

package com.codehive.MPBS.DTO;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequestDTO {
    @NotBlank
    private String customerName;
    @NotBlank
    private String vehicleNumber;
    @NotBlank
    private String vehicleType;
    @NotBlank
    private String slotNumber;
    @NotBlank
    private String month;
    @NotBlank
    private String year;
    @NotBlank
    private String paymentMode;
}

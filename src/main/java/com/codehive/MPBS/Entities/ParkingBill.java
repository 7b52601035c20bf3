package com.codehive.MPBS.Entities;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

// One month of rent for one slot, written once and never updated
@Data
@Document(collection = "parking_bills")
@CompoundIndexes({
        // A slot can be rented only once per rental period
        @CompoundIndex(name = "slot_period_idx", def = "{'slotNumber': 1, 'month': 1, 'year': 1}", unique = true),
        @CompoundIndex(name = "bill_date_idx", def = "{'billDate': -1}")
})
public class ParkingBill {

    public static final String SEQUENCE_NAME = "parking_bill_sequence";

    @Id
    private Long id;
    private String customerName;
    private String vehicleNumber;
    private String vehicleType;
    private String slotNumber;
    private String month; // Full English name, e.g. "January"
    private String year; // e.g. "2025"
    private String paymentMode;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal amount;

    private LocalDateTime billDate;
    private String generatedBy;
    private boolean paid = true;
}

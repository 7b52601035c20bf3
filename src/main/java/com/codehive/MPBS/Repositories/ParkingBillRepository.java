package com.codehive.MPBS.Repositories;

import com.codehive.MPBS.Entities.ParkingBill;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ParkingBillRepository extends MongoRepository<ParkingBill, Long> {

    // Backed by the unique slot_period_idx
    boolean existsBySlotNumberAndMonthAndYear(String slotNumber, String month, String year);

    List<ParkingBill> findTop5ByOrderByBillDateDesc();
}

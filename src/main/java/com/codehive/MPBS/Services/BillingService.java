package com.codehive.MPBS.Services;

import com.codehive.MPBS.DTO.BookingRequestDTO;
import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Exceptions.BillGenerationException;
import com.codehive.MPBS.Exceptions.InvalidBookingException;
import com.codehive.MPBS.Exceptions.ResourceNotFoundException;
import com.codehive.MPBS.Exceptions.SlotOccupiedException;
import com.codehive.MPBS.Repositories.ParkingBillRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
public class BillingService {

    public static final BigDecimal MONTHLY_CHARGE = new BigDecimal("1000.00");

    // Long enough to cover check + insert, short enough that a crashed request frees the slot
    private static final Duration LOCK_TTL = Duration.ofSeconds(10);

    // Deletes the lock only while it still holds this request's token
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    @Autowired
    private ParkingBillRepository parkingBillRepository;

    @Autowired
    private SequenceGeneratorService sequenceGeneratorService;

    @Autowired
    private RedisTemplate<String, Object> redisTemplate;

    @Autowired
    private ParkingCatalog parkingCatalog;

    @Autowired
    private Clock clock;

    /**
     * Rents a slot for one month and records the bill.
     *
     * @throws InvalidBookingException if the slot, month or year is not in the catalog
     * @throws SlotOccupiedException   if the slot is already rented for that month and year
     */
    public ParkingBill createBill(BookingRequestDTO request, String actorUsername) {
        // 1. Validate against the fixed catalog
        String slotNumber = request.getSlotNumber().trim();
        if (!parkingCatalog.isSlot(slotNumber)) {
            throw new InvalidBookingException("Unknown parking slot: " + slotNumber);
        }
        String month = parkingCatalog.normalizeMonth(request.getMonth())
                .orElseThrow(() -> new InvalidBookingException("Unknown month: " + request.getMonth()));
        String year = request.getYear().trim();
        if (!parkingCatalog.isYear(year)) {
            throw new InvalidBookingException("Year must be between " + ParkingCatalog.FIRST_YEAR + " and "
                    + ParkingCatalog.LAST_YEAR + ": " + year);
        }

        // 2. Serialize concurrent bookings of the same slot and period
        String lockKey = lockKey(slotNumber, month, year);
        String lockToken = UUID.randomUUID().toString();
        boolean locked = acquireLock(lockKey, lockToken);

        try {
            // 3. Occupancy check
            if (parkingBillRepository.existsBySlotNumberAndMonthAndYear(slotNumber, month, year)) {
                throw new SlotOccupiedException(slotNumber, month, year);
            }

            // 4. Record the bill; slot_period_idx still rejects a lost race
            ParkingBill bill = new ParkingBill();
            bill.setId(sequenceGeneratorService.generateSequence(ParkingBill.SEQUENCE_NAME));
            bill.setCustomerName(request.getCustomerName().trim());
            bill.setVehicleNumber(request.getVehicleNumber().trim().toUpperCase(Locale.ROOT));
            bill.setVehicleType(request.getVehicleType().trim());
            bill.setSlotNumber(slotNumber);
            bill.setMonth(month);
            bill.setYear(year);
            bill.setPaymentMode(request.getPaymentMode().trim());
            bill.setAmount(MONTHLY_CHARGE);
            bill.setBillDate(LocalDateTime.now(clock));
            bill.setGeneratedBy(actorUsername);
            bill.setPaid(true);

            ParkingBill saved = parkingBillRepository.insert(bill);
            log.info("Bill {} created: slot={}, period={} {}, by={}", saved.getId(), slotNumber, month, year,
                    actorUsername);
            return saved;
        } catch (DuplicateKeyException e) {
            log.info("Lost booking race for {} {} {}", slotNumber, month, year);
            throw new SlotOccupiedException(slotNumber, month, year);
        } catch (DataAccessException e) {
            throw new BillGenerationException(e.getMessage(), e);
        } finally {
            if (locked) {
                releaseLock(lockKey, lockToken);
            }
        }
    }

    public ParkingBill findBill(Long id) {
        return parkingBillRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Bill", id));
    }

    static String lockKey(String slotNumber, String month, String year) {
        return "slot:lock:" + slotNumber + ":" + month + ":" + year;
    }

    // Returns true when this request holds the lock and must release it
    private boolean acquireLock(String lockKey, String token) {
        Boolean acquired;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, token, LOCK_TTL);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, booking {} guarded by unique index only: {}", lockKey, e.getMessage());
            return false;
        }

        if (!Boolean.TRUE.equals(acquired)) {
            // The holder may still fail, so only the ledger decides whether the slot is taken
            log.info("{} is held by another booking, continuing without it", lockKey);
            return false;
        }
        return true;
    }

    private void releaseLock(String lockKey, String token) {
        try {
            redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(lockKey), token);
        } catch (DataAccessException e) {
            log.warn("Could not release {}, it expires in {}s: {}", lockKey, LOCK_TTL.getSeconds(), e.getMessage());
        }
    }
}

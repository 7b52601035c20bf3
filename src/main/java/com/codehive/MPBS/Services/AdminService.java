package com.codehive.MPBS.Services;

import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Entities.Role;
import com.codehive.MPBS.Entities.Users;
import com.codehive.MPBS.Exceptions.DuplicateUsernameException;
import com.codehive.MPBS.Exceptions.ProtectedResourceException;
import com.codehive.MPBS.Exceptions.ResourceNotFoundException;
import com.codehive.MPBS.Repositories.ParkingBillRepository;
import com.codehive.MPBS.Repositories.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

@Slf4j
@Service
public class AdminService {

    public static final int BILLS_PAGE_SIZE = 20;
    public static final int SEARCH_LIMIT = 50;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "billDate");

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ParkingBillRepository parkingBillRepository;

    @Autowired
    private MongoTemplate mongoTemplate;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private Clock clock;

    // --- User Management ---
    public List<Users> listUsers() {
        return userRepository.findAll();
    }

    public Users addUser(String username, String password, Role role) {
        String trimmed = username.trim();
        if (userRepository.existsByUsername(trimmed)) {
            throw new DuplicateUsernameException(trimmed);
        }

        Users user = new Users();
        user.setUsername(trimmed);
        user.setPassword(passwordEncoder.encode(password));
        user.setRole(role);
        user.setPrimaryAdmin(false);
        user.setCreatedAt(LocalDateTime.now(clock));

        try {
            Users saved = userRepository.insert(user);
            log.info("User '{}' added with role {}", saved.getUsername(), role);
            return saved;
        } catch (DuplicateKeyException e) {
            // Same username inserted concurrently
            throw new DuplicateUsernameException(trimmed);
        }
    }

    public void deleteUser(String id) {
        Users user = userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", id));

        if (user.isPrimaryAdmin()) {
            throw new ProtectedResourceException("Cannot delete primary admin!");
        }

        userRepository.delete(user);
        log.info("User '{}' deleted", user.getUsername());
    }

    // --- Bills ---

    // 1-based; pages below 1 read as the first
    public Page<ParkingBill> listBills(int page) {
        return parkingBillRepository.findAll(PageRequest.of(Math.max(page, 1) - 1, BILLS_PAGE_SIZE, NEWEST_FIRST));
    }

    /**
     * Case-insensitive substring search over customer name, vehicle number and slot number.
     * An empty query matches nothing.
     */
    public List<ParkingBill> search(String query) {
        if (query == null || query.isEmpty()) {
            return Collections.emptyList();
        }

        // Quote so that "SLOT-01" or "a.b" match literally
        String pattern = Pattern.quote(query);
        Query mongoQuery = new Query(new Criteria().orOperator(
                Criteria.where("customerName").regex(pattern, "i"),
                Criteria.where("vehicleNumber").regex(pattern, "i"),
                Criteria.where("slotNumber").regex(pattern, "i")))
                .with(NEWEST_FIRST)
                .limit(SEARCH_LIMIT);

        return mongoTemplate.find(mongoQuery, ParkingBill.class);
    }
}

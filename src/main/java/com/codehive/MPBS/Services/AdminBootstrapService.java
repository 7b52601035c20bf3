package com.codehive.MPBS.Services;

import com.codehive.MPBS.Config.ParkingProperties;
import com.codehive.MPBS.Entities.Role;
import com.codehive.MPBS.Entities.Users;
import com.codehive.MPBS.Exceptions.DuplicateUsernameException;
import com.codehive.MPBS.Exceptions.SetupAlreadyCompletedException;
import com.codehive.MPBS.Repositories.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Creates the primary admin, either from configuration at startup or through the first-run
 * setup call. No account ships with a built-in password.
 */
@Slf4j
@Service
public class AdminBootstrapService {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private ParkingProperties parkingProperties;

    @Autowired
    private Clock clock;

    public boolean isSetupComplete() {
        return userRepository.existsByPrimaryAdminTrue();
    }

    public Optional<Users> bootstrapFromConfiguration() {
        if (isSetupComplete()) {
            return Optional.empty();
        }

        ParkingProperties.Bootstrap bootstrap = parkingProperties.getBootstrap();
        if (!StringUtils.hasText(bootstrap.getAdminPassword())) {
            log.warn("No primary admin exists and parking.bootstrap.admin-password is not set. "
                    + "Create one with POST /api/public/setup");
            return Optional.empty();
        }

        return Optional.of(createPrimaryAdmin(bootstrap.getAdminUsername(), bootstrap.getAdminPassword()));
    }

    public Users completeSetup(String username, String password) {
        if (isSetupComplete()) {
            throw new SetupAlreadyCompletedException();
        }
        return createPrimaryAdmin(username.trim(), password);
    }

    private Users createPrimaryAdmin(String username, String password) {
        if (userRepository.existsByUsername(username)) {
            throw new DuplicateUsernameException(username);
        }

        Users admin = new Users();
        admin.setUsername(username);
        admin.setPassword(passwordEncoder.encode(password));
        admin.setRole(Role.ADMIN);
        admin.setPrimaryAdmin(true);
        admin.setCreatedAt(LocalDateTime.now(clock));

        Users saved = userRepository.insert(admin);
        log.info("Primary admin '{}' created", saved.getUsername());
        return saved;
    }
}

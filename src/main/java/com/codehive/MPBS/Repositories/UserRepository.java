package com.codehive.MPBS.Repositories;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.codehive.MPBS.Entities.Users;

import java.util.Optional;

public interface UserRepository extends MongoRepository<Users, String> {
    Optional<Users> findByUsername(String username);

    boolean existsByUsername(String username);

    boolean existsByPrimaryAdminTrue();
}

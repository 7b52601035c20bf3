package com.codehive.MPBS.Entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.LocalDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Document(collection = "users")
public class Users {
    @Id
    private String id;

    @Indexed(unique = true)
    private String username;

    @JsonIgnore
    private String password; // Stored as BCrypt hash

    private Role role;

    // Set only on the account created by first-run setup; such a user can never be deleted
    private boolean primaryAdmin = false;

    private LocalDateTime createdAt;
}

package com.codeops.drive.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Read-only view of the user directory. Rows are provisioned by the identity service;
 * this service only looks users up to validate grantees and to show display names.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriveUser {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    public String getDisplayName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        String name = (first + " " + last).trim();
        return name.isEmpty() ? email : name;
    }
}

package com.serge.scheduler.domain;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAccount {
    @Id
    private String id;

    private String name;

    /** Always stored lower-cased. */
    @Indexed(unique = true)
    private String email;

    private String passwordHash;

    /** A URL, a serialized {thumb, small, medium} size set, or empty. */
    private String imageUrl;

    @Builder.Default
    private String address = "";

    private LocalDate dob;

    @Builder.Default
    private Role role = Role.USER;

    @Builder.Default
    private List<String> createdEvents = new ArrayList<>();

    @CreatedDate
    private Instant createdAt;
    @LastModifiedDate
    private Instant updatedAt;
}

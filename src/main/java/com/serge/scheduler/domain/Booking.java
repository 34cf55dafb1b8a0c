package com.serge.scheduler.domain;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A reservation of one event by one user. The (user, event) pair is unique.
 */
@Document(collection = "bookings")
@CompoundIndex(name = "booking_user_event", def = "{'user': 1, 'event': 1}", unique = true)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {
    @Id
    private String id;

    /** Booked event id. */
    private String event;

    /** Booking user id. */
    private String user;

    @CreatedDate
    private Instant createdAt;
    @LastModifiedDate
    private Instant updatedAt;
}

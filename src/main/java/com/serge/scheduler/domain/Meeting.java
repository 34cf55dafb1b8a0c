package com.serge.scheduler.domain;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "meetings")
@CompoundIndex(name = "meeting_time_range", def = "{'startTime': 1, 'endTime': 1}")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Meeting {
    @Id
    private String id;

    private String title;

    @Builder.Default
    private String description = "";

    private Instant startTime;
    private Instant endTime;

    /** Attendee user ids. */
    @Builder.Default
    private List<String> attendees = new ArrayList<>();

    @Indexed
    private String createdBy;

    @CreatedDate
    private Instant createdAt;
    @LastModifiedDate
    private Instant updatedAt;
}

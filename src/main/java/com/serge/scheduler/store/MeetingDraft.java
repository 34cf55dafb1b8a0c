package com.serge.scheduler.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Validated meeting fields, ready to be written. */
@Value
@Builder(toBuilder = true)
public class MeetingDraft {
    String title;
    String description;
    Instant startTime;
    Instant endTime;
    List<String> attendeeIds;
}

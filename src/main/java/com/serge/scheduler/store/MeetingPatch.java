package com.serge.scheduler.store;

import com.serge.scheduler.domain.Meeting;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Validated partial meeting update; null fields are left unchanged. */
@Value
@Builder
public class MeetingPatch {
    String title;
    String description;
    Instant startTime;
    Instant endTime;
    List<String> attendeeIds;

    public MeetingDraft applyTo(Meeting current) {
        return MeetingDraft.builder()
                .title(title != null ? title : current.getTitle())
                .description(description != null ? description : current.getDescription())
                .startTime(startTime != null ? startTime : current.getStartTime())
                .endTime(endTime != null ? endTime : current.getEndTime())
                .attendeeIds(attendeeIds != null ? attendeeIds : current.getAttendees())
                .build();
    }
}

package com.serge.scheduler.input;

import com.serge.scheduler.store.MeetingDraft;
import com.serge.scheduler.util.DateTimes;
import com.serge.scheduler.validation.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@MeetingWindow
public class CreateMeetingInput implements TimeWindow {
    @NotBlank(message = Patterns.TITLE_REQUIRED)
    @Size(max = 100, message = Patterns.TITLE_MAX)
    private String title;

    private String description;

    @NotNull(message = "Invalid startTime")
    @IsoDateTime(message = "Invalid startTime")
    private String startTime;

    @NotNull(message = "Invalid endTime")
    @IsoDateTime(message = "Invalid endTime")
    private String endTime;

    private List<@NotNull(message = "Invalid attendee id") @ObjectIdString(message = "Invalid attendee id") String> attendeeIds;

    /** Only meaningful once validated. */
    public MeetingDraft toDraft() {
        return MeetingDraft.builder()
                .title(title.trim())
                .description(description == null ? "" : description)
                .startTime(DateTimes.parseInstant(startTime).orElseThrow())
                .endTime(DateTimes.parseInstant(endTime).orElseThrow())
                .attendeeIds(attendeeIds == null ? List.of() : new ArrayList<>(attendeeIds))
                .build();
    }
}

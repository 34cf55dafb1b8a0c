package com.serge.scheduler.input;

import com.serge.scheduler.store.MeetingPatch;
import com.serge.scheduler.util.DateTimes;
import com.serge.scheduler.validation.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@MeetingWindow(partial = true)
public class UpdateMeetingInput implements TimeWindow {
    @Size(min = 1, message = Patterns.TITLE_REQUIRED)
    @Size(max = 100, message = Patterns.TITLE_MAX)
    @Pattern(regexp = "(?s).*\\S.*", message = Patterns.TITLE_REQUIRED)
    private String title;

    private String description;

    @IsoDateTime(message = "Invalid startTime")
    private String startTime;

    @IsoDateTime(message = "Invalid endTime")
    private String endTime;

    private List<@NotNull(message = "Invalid attendee id") @ObjectIdString(message = "Invalid attendee id") String> attendeeIds;

    public MeetingPatch toPatch() {
        return MeetingPatch.builder()
                .title(title == null ? null : title.trim())
                .description(description)
                .startTime(DateTimes.parseInstant(startTime).orElse(null))
                .endTime(DateTimes.parseInstant(endTime).orElse(null))
                .attendeeIds(attendeeIds == null ? null : new ArrayList<>(attendeeIds))
                .build();
    }
}

package com.serge.scheduler.web.dto;

import com.serge.scheduler.domain.Meeting;
import com.serge.scheduler.store.PopulatedMeeting;
import com.serge.scheduler.util.DateTimes;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class MeetingDto {
    String id;
    String title;
    String description;
    String startTime;
    String endTime;
    List<UserDto> attendees;
    UserDto createdBy;
    String createdAt;
    String updatedAt;

    public static MeetingDto from(PopulatedMeeting pm) {
        Meeting m = pm.getMeeting();
        return new MeetingDto(
                m.getId(),
                m.getTitle(),
                m.getDescription() == null ? "" : m.getDescription(),
                DateTimes.iso(m.getStartTime()),
                DateTimes.iso(m.getEndTime()),
                pm.getAttendees().stream().map(UserDto::from).collect(Collectors.toList()),
                UserDto.from(pm.getCreatedBy()),
                DateTimes.iso(m.getCreatedAt()),
                DateTimes.iso(m.getUpdatedAt()));
    }
}

package com.serge.scheduler.web.dto;

import com.serge.scheduler.domain.Event;
import com.serge.scheduler.store.PopulatedEvent;
import com.serge.scheduler.util.DateTimes;
import lombok.Value;

@Value
public class EventDto {
    String id;
    String title;
    String description;
    String date;
    double price;
    UserDto createdBy;
    String createdAt;
    String updatedAt;

    public static EventDto from(PopulatedEvent pe) {
        if (pe == null) return null;
        Event e = pe.getEvent();
        return new EventDto(
                e.getId(),
                e.getTitle(),
                e.getDescription() == null ? "" : e.getDescription(),
                DateTimes.iso(e.getDate()),
                e.getPrice(),
                UserDto.from(pe.getCreatedBy()),
                DateTimes.iso(e.getCreatedAt()),
                DateTimes.iso(e.getUpdatedAt()));
    }
}

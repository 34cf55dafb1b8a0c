package com.serge.scheduler.web.dto;

import com.serge.scheduler.domain.Booking;
import com.serge.scheduler.store.PopulatedBooking;
import com.serge.scheduler.util.DateTimes;
import lombok.Value;

@Value
public class BookingDto {
    String id;
    EventDto event;
    UserDto user;
    String createdAt;
    String updatedAt;

    public static BookingDto from(PopulatedBooking pb) {
        Booking b = pb.getBooking();
        return new BookingDto(
                b.getId(),
                EventDto.from(pb.getEvent()),
                UserDto.from(pb.getUser()),
                DateTimes.iso(b.getCreatedAt()),
                DateTimes.iso(b.getUpdatedAt()));
    }
}

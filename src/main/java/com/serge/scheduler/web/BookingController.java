package com.serge.scheduler.web;

import com.serge.scheduler.service.BookingService;
import com.serge.scheduler.web.dto.BookingDto;
import com.serge.scheduler.web.dto.EventDto;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.stream.Collectors;

@Controller
@RequiredArgsConstructor
public class BookingController {
    private final BookingService bookingService;

    @QueryMapping
    public List<BookingDto> bookings(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId) {
        Callers.require(callerId);
        return bookingService.list().stream().map(BookingDto::from).collect(Collectors.toList());
    }

    @MutationMapping
    public BookingDto bookEvent(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                @Argument String eventId) {
        return BookingDto.from(bookingService.book(Callers.require(callerId), eventId));
    }

    @MutationMapping
    public EventDto cancelBooking(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                  @Argument String bookingId) {
        return EventDto.from(bookingService.cancel(Callers.require(callerId), bookingId));
    }
}

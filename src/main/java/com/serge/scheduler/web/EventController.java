package com.serge.scheduler.web;

import com.serge.scheduler.input.EventFilterInput;
import com.serge.scheduler.input.EventInput;
import com.serge.scheduler.service.EventService;
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
public class EventController {
    private final EventService eventService;

    @QueryMapping
    public List<EventDto> events(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                 @Argument EventFilterInput filter) {
        Callers.require(callerId);
        return eventService.list(filter).stream().map(EventDto::from).collect(Collectors.toList());
    }

    @QueryMapping
    public EventDto event(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                          @Argument String id) {
        Callers.require(callerId);
        return eventService.find(id).map(EventDto::from).orElse(null);
    }

    @MutationMapping
    public EventDto createEvent(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                @Argument EventInput eventInput) {
        return EventDto.from(eventService.create(Callers.require(callerId), eventInput));
    }

    @MutationMapping
    public EventDto updateEvent(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                @Argument String id,
                                @Argument EventInput eventInput) {
        return EventDto.from(eventService.update(Callers.require(callerId), id, eventInput));
    }

    @MutationMapping
    public boolean deleteEvent(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                               @Argument String id) {
        return eventService.delete(Callers.require(callerId), id);
    }
}

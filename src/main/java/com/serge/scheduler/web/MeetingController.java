package com.serge.scheduler.web;

import com.serge.scheduler.input.CreateMeetingInput;
import com.serge.scheduler.input.DateRangeInput;
import com.serge.scheduler.input.UpdateMeetingInput;
import com.serge.scheduler.service.MeetingService;
import com.serge.scheduler.store.PopulatedMeeting;
import com.serge.scheduler.web.dto.MeetingDto;
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
public class MeetingController {
    private final MeetingService meetingService;

    @QueryMapping
    public List<MeetingDto> meetings(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId) {
        Callers.require(callerId);
        return toDtos(meetingService.list());
    }

    @QueryMapping
    public MeetingDto meeting(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                              @Argument String id) {
        Callers.require(callerId);
        return meetingService.find(id).map(MeetingDto::from).orElse(null);
    }

    @QueryMapping
    public List<MeetingDto> myMeetings(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId) {
        return toDtos(meetingService.mine(Callers.require(callerId)));
    }

    @QueryMapping
    public List<MeetingDto> meetingsByDateRange(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                                @Argument DateRangeInput dateRange) {
        Callers.require(callerId);
        return toDtos(meetingService.byDateRange(dateRange));
    }

    @QueryMapping
    public int countMeetings(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId) {
        Callers.require(callerId);
        return Math.toIntExact(meetingService.count());
    }

    @MutationMapping
    public MeetingDto createMeeting(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                    @Argument CreateMeetingInput input) {
        return MeetingDto.from(meetingService.create(Callers.require(callerId), input));
    }

    @MutationMapping
    public MeetingDto updateMeeting(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                    @Argument String id,
                                    @Argument UpdateMeetingInput input) {
        return MeetingDto.from(meetingService.update(Callers.require(callerId), id, input));
    }

    @MutationMapping
    public boolean deleteMeeting(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId,
                                 @Argument String id) {
        return meetingService.delete(Callers.require(callerId), id);
    }

    private static List<MeetingDto> toDtos(List<PopulatedMeeting> meetings) {
        return meetings.stream().map(MeetingDto::from).collect(Collectors.toList());
    }
}

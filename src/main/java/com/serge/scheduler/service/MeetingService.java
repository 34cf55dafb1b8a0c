package com.serge.scheduler.service;

import com.serge.scheduler.domain.Meeting;
import com.serge.scheduler.error.*;
import com.serge.scheduler.input.CreateMeetingInput;
import com.serge.scheduler.input.DateRangeInput;
import com.serge.scheduler.input.UpdateMeetingInput;
import com.serge.scheduler.store.MeetingDraft;
import com.serge.scheduler.store.MeetingStore;
import com.serge.scheduler.store.PopulatedMeeting;
import com.serge.scheduler.util.DateTimes;
import com.serge.scheduler.validation.InputValidator;
import com.serge.scheduler.validation.MeetingRules;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class MeetingService {
    private static final Logger log = LoggerFactory.getLogger(MeetingService.class);

    private final MeetingStore meetingStore;
    private final OwnershipGuard guard;
    private final InputValidator validator;

    public List<PopulatedMeeting> list() {
        return meetingStore.listAllPopulated();
    }

    public Optional<PopulatedMeeting> find(String id) {
        return meetingStore.findPopulated(id);
    }

    public List<PopulatedMeeting> mine(String callerId) {
        return meetingStore.listForUser(callerId);
    }

    /** Meetings that overlap the range, bounds inclusive. */
    public List<PopulatedMeeting> byDateRange(DateRangeInput range) {
        validator.validate("meetingsByDateRange", range);
        Instant from = DateTimes.parseInstant(range.getStartDate()).orElseThrow();
        Instant to = DateTimes.parseInstant(range.getEndDate()).orElseThrow();
        if (to.isBefore(from)) {
            throw ValidationException.of("endDate", "endDate must not be before startDate");
        }
        return meetingStore.listOverlapping(from, to);
    }

    public long count() {
        return meetingStore.count();
    }

    public PopulatedMeeting create(String callerId, CreateMeetingInput input) {
        validator.validate("createMeeting", input);
        PopulatedMeeting created = meetingStore.create(input.toDraft(), callerId);
        log.info("meeting.created meetingId={} by={}", created.getMeeting().getId(), callerId);
        return created;
    }

    public PopulatedMeeting update(String callerId, String id, UpdateMeetingInput input) {
        validator.validate("updateMeeting", input);
        Optional<Meeting> current = meetingStore.findById(id);
        if (guard.requireNotForbidden(current, Meeting::getCreatedBy, callerId) == OwnershipCheck.NOT_FOUND) {
            throw new NotFoundException(Messages.MEETING_NOT_FOUND);
        }
        MeetingDraft merged = input.toPatch().applyTo(current.get());
        MeetingRules.windowProblem(merged.getStartTime(), merged.getEndTime()).ifPresent(problem -> {
            throw ValidationException.of("endTime", problem);
        });
        PopulatedMeeting updated = meetingStore.updateIfOwner(id, callerId, merged)
                .orElseThrow(() -> new NotFoundException(Messages.MEETING_NOT_FOUND));
        log.info("meeting.updated meetingId={} by={}", id, callerId);
        return updated;
    }

    /** True when deleted; false when there was nothing to delete. */
    public boolean delete(String callerId, String id) {
        Optional<Meeting> current = meetingStore.findById(id);
        if (guard.requireNotForbidden(current, Meeting::getCreatedBy, callerId) == OwnershipCheck.NOT_FOUND) {
            log.info("meeting.delete.missing meetingId={} by={}", id, callerId);
            return false;
        }
        boolean deleted = meetingStore.deleteIfOwner(id, callerId);
        log.info("meeting.deleted meetingId={} by={} deleted={}", id, callerId, deleted);
        return deleted;
    }
}

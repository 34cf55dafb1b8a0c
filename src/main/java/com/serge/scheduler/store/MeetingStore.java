package com.serge.scheduler.store;

import com.serge.scheduler.domain.Meeting;
import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.repo.MeetingRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Sole access path to the {@code meetings} collection.
 */
@Component
@RequiredArgsConstructor
public class MeetingStore {
    private static final Logger log = LoggerFactory.getLogger(MeetingStore.class);
    private static final Sort BY_START = Sort.by(Sort.Direction.ASC, "startTime");

    private final MeetingRepository meetings;
    private final UserStore userStore;
    private final MongoTemplate mongo;

    public Optional<Meeting> findById(String id) {
        return meetings.findById(id);
    }

    public Optional<PopulatedMeeting> findPopulated(String id) {
        return meetings.findById(id).map(this::populate);
    }

    public List<PopulatedMeeting> listAllPopulated() {
        return populate(meetings.findAll(BY_START));
    }

    /** Meetings the user created or attends. */
    public List<PopulatedMeeting> listForUser(String userId) {
        return populate(meetings.findForUser(userId, BY_START));
    }

    public List<PopulatedMeeting> listOverlapping(Instant from, Instant to) {
        return populate(meetings.findOverlapping(from, to, BY_START));
    }

    public long count() {
        return meetings.count();
    }

    public PopulatedMeeting create(MeetingDraft draft, String creatorId) {
        Meeting meeting = Meeting.builder()
                .title(draft.getTitle())
                .description(draft.getDescription())
                .startTime(draft.getStartTime())
                .endTime(draft.getEndTime())
                .attendees(new ArrayList<>(draft.getAttendeeIds()))
                .createdBy(creatorId)
                .build();
        Meeting saved = StoreErrors.write("create meeting", () -> meetings.insert(meeting));
        log.debug("store.meeting.created meetingId={} creatorId={}", saved.getId(), creatorId);
        return populate(saved);
    }

    /** Replaces the meeting's fields only while {@code ownerId} still owns it. */
    public Optional<PopulatedMeeting> updateIfOwner(String id, String ownerId, MeetingDraft draft) {
        Query query = new Query(Criteria.where("id").is(id).and("createdBy").is(ownerId));
        Update update = new Update()
                .set("title", draft.getTitle())
                .set("description", draft.getDescription())
                .set("startTime", draft.getStartTime())
                .set("endTime", draft.getEndTime())
                .set("attendees", draft.getAttendeeIds())
                .set("updatedAt", Instant.now());
        Meeting updated = StoreErrors.write("update meeting", () -> mongo.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), Meeting.class));
        return Optional.ofNullable(updated).map(this::populate);
    }

    public boolean deleteIfOwner(String id, String ownerId) {
        return StoreErrors.write("delete meeting", () -> meetings.deleteByIdAndCreatedBy(id, ownerId)) > 0;
    }

    private PopulatedMeeting populate(Meeting meeting) {
        return populate(List.of(meeting)).get(0);
    }

    private List<PopulatedMeeting> populate(List<Meeting> list) {
        Set<String> userIds = new HashSet<>();
        for (Meeting m : list) {
            if (m.getCreatedBy() != null) userIds.add(m.getCreatedBy());
            if (m.getAttendees() != null) userIds.addAll(m.getAttendees());
        }
        Map<String, UserAccount> byId = userStore.findByIds(userIds);
        return list.stream().map(m -> new PopulatedMeeting(
                m,
                byId.get(m.getCreatedBy()),
                Optional.ofNullable(m.getAttendees()).orElse(List.of()).stream()
                        .map(byId::get)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList())
        )).collect(Collectors.toList());
    }
}

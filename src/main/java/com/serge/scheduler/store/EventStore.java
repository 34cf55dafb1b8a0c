package com.serge.scheduler.store;

import com.serge.scheduler.domain.Event;
import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.repo.EventRepository;
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
 * Sole access path to the {@code events} collection. Keeps the creator's {@code createdEvents}
 * back-reference in step on a best-effort basis.
 */
@Component
@RequiredArgsConstructor
public class EventStore {
    private static final Logger log = LoggerFactory.getLogger(EventStore.class);
    private static final Sort BY_DATE = Sort.by(Sort.Direction.ASC, "date");

    private final EventRepository events;
    private final UserStore userStore;
    private final MongoTemplate mongo;

    public Optional<Event> findById(String id) {
        return events.findById(id);
    }

    public Optional<PopulatedEvent> findPopulated(String id) {
        return events.findById(id).map(this::populate);
    }

    public List<PopulatedEvent> listAllPopulated() {
        return populate(events.findAll(BY_DATE));
    }

    public List<PopulatedEvent> listFiltered(EventFilter filter) {
        Query query = new Query();
        if (filter.getCreatedById() != null) {
            query.addCriteria(Criteria.where("createdBy").is(filter.getCreatedById()));
        }
        if (filter.getDateFrom() != null || filter.getDateTo() != null) {
            Criteria date = Criteria.where("date");
            if (filter.getDateFrom() != null) date = date.gte(filter.getDateFrom());
            if (filter.getDateTo() != null) date = date.lte(filter.getDateTo());
            query.addCriteria(date);
        }
        query.with(BY_DATE);
        List<Event> found = mongo.find(query, Event.class);
        log.debug("store.event.filtered createdBy={} from={} to={} count={}",
                filter.getCreatedById(), filter.getDateFrom(), filter.getDateTo(), found.size());
        return populate(found);
    }

    /** Lean events for the given ids, date ascending. */
    public List<Event> findAllByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return List.of();
        List<Event> found = new ArrayList<>();
        events.findAllById(new LinkedHashSet<>(ids)).forEach(found::add);
        found.sort(Comparator.comparing(Event::getDate, Comparator.nullsLast(Comparator.naturalOrder())));
        return found;
    }

    /** Populated events for the given ids, date ascending. Unknown ids are skipped. */
    public List<PopulatedEvent> findPopulatedByIds(Collection<String> ids) {
        return populate(findAllByIds(ids));
    }

    /**
     * Inserts the event, then links it to its creator. The link is not transactional with the insert:
     * the event is kept even when the link fails.
     */
    public PopulatedEvent create(EventDraft draft, String creatorId) {
        Event event = Event.builder()
                .title(draft.getTitle())
                .description(draft.getDescription())
                .date(draft.getDate())
                .price(draft.getPrice())
                .createdBy(creatorId)
                .build();
        Event saved = StoreErrors.write("create event", () -> events.insert(event));
        if (!userStore.linkCreatedEvent(creatorId, saved.getId())) {
            log.warn("store.event.created_unlinked eventId={} creatorId={}", saved.getId(), creatorId);
        }
        return populate(saved);
    }

    /**
     * Applies the draft only when the event is still owned by {@code ownerId} at write time.
     * Empty when the event is gone or changed hands.
     */
    public Optional<PopulatedEvent> updateIfOwner(String id, String ownerId, EventDraft draft) {
        Query query = new Query(Criteria.where("id").is(id).and("createdBy").is(ownerId));
        Update update = new Update()
                .set("title", draft.getTitle())
                .set("description", draft.getDescription())
                .set("date", draft.getDate())
                .set("price", draft.getPrice())
                .set("updatedAt", Instant.now());
        Event updated = StoreErrors.write("update event", () -> mongo.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), Event.class));
        return Optional.ofNullable(updated).map(this::populate);
    }

    /** Deletes only if still owned by {@code ownerId}; also drops the back-reference (best effort). */
    public boolean deleteIfOwner(String id, String ownerId) {
        long deleted = StoreErrors.write("delete event", () -> events.deleteByIdAndCreatedBy(id, ownerId));
        if (deleted > 0) {
            userStore.unlinkCreatedEvent(ownerId, id);
        }
        return deleted > 0;
    }

    PopulatedEvent populate(Event event) {
        return populate(List.of(event)).get(0);
    }

    List<PopulatedEvent> populate(List<Event> list) {
        Set<String> creatorIds = list.stream().map(Event::getCreatedBy).filter(Objects::nonNull).collect(Collectors.toSet());
        Map<String, UserAccount> creators = userStore.findByIds(creatorIds);
        return list.stream()
                .map(e -> new PopulatedEvent(e, creators.get(e.getCreatedBy())))
                .collect(Collectors.toList());
    }
}

package com.serge.scheduler.service;

import com.serge.scheduler.domain.Event;
import com.serge.scheduler.error.BadInputException;
import com.serge.scheduler.error.Messages;
import com.serge.scheduler.input.EventFilterInput;
import com.serge.scheduler.input.EventInput;
import com.serge.scheduler.store.EventStore;
import com.serge.scheduler.store.PopulatedEvent;
import com.serge.scheduler.validation.InputValidator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventStore eventStore;
    private final OwnershipGuard guard;
    private final InputValidator validator;

    public List<PopulatedEvent> list(EventFilterInput filter) {
        if (filter == null) return eventStore.listAllPopulated();
        validator.validate("events", filter);
        return eventStore.listFiltered(filter.toFilter());
    }

    public Optional<PopulatedEvent> find(String id) {
        return eventStore.findPopulated(id);
    }

    public PopulatedEvent create(String callerId, EventInput input) {
        validator.validate("createEvent", input);
        PopulatedEvent created = eventStore.create(input.toDraft(), callerId);
        log.info("event.created eventId={} by={}", created.getEvent().getId(), callerId);
        return created;
    }

    /** Without an input the event is returned unchanged, once ownership is confirmed. */
    public PopulatedEvent update(String callerId, String id, EventInput input) {
        if (input != null) validator.validate("updateEvent", input);
        Optional<Event> current = eventStore.findById(id);
        if (guard.requireNotForbidden(current, Event::getCreatedBy, callerId) == OwnershipCheck.NOT_FOUND) {
            throw new BadInputException(Messages.EVENT_NOT_FOUND);
        }
        if (input == null) {
            return eventStore.findPopulated(id).orElseThrow(() -> new BadInputException(Messages.EVENT_NOT_FOUND));
        }
        PopulatedEvent updated = eventStore.updateIfOwner(id, callerId, input.toDraft())
                .orElseThrow(() -> new BadInputException(Messages.EVENT_NOT_FOUND));
        log.info("event.updated eventId={} by={}", id, callerId);
        return updated;
    }

    public boolean delete(String callerId, String id) {
        Optional<Event> current = eventStore.findById(id);
        if (guard.requireNotForbidden(current, Event::getCreatedBy, callerId) == OwnershipCheck.NOT_FOUND) {
            log.info("event.delete.missing eventId={} by={}", id, callerId);
            return false;
        }
        boolean deleted = eventStore.deleteIfOwner(id, callerId);
        log.info("event.deleted eventId={} by={} deleted={}", id, callerId, deleted);
        return deleted;
    }
}

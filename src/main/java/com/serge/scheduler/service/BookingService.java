package com.serge.scheduler.service;

import com.serge.scheduler.domain.Booking;
import com.serge.scheduler.error.BadInputException;
import com.serge.scheduler.error.ConflictException;
import com.serge.scheduler.error.Messages;
import com.serge.scheduler.error.StoreException;
import com.serge.scheduler.store.BookingStore;
import com.serge.scheduler.store.EventStore;
import com.serge.scheduler.store.PopulatedBooking;
import com.serge.scheduler.store.PopulatedEvent;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class BookingService {
    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private final BookingStore bookingStore;
    private final EventStore eventStore;
    private final OwnershipGuard guard;

    public List<PopulatedBooking> list() {
        return bookingStore.listAllPopulated();
    }

    public PopulatedBooking book(String callerId, String eventId) {
        if (eventId == null || !ObjectId.isValid(eventId) || eventStore.findById(eventId).isEmpty()) {
            log.info("booking.book.event_missing eventId={} by={}", eventId, callerId);
            throw new BadInputException(Messages.EVENT_NOT_FOUND);
        }
        if (bookingStore.exists(callerId, eventId)) {
            throw new ConflictException(Messages.ALREADY_BOOKED);
        }
        try {
            PopulatedBooking booking = bookingStore.create(eventId, callerId);
            log.info("booking.created bookingId={} eventId={} by={}", booking.getBooking().getId(), eventId, callerId);
            return booking;
        } catch (StoreException e) {
            if (e.isDuplicateKey()) throw new ConflictException(Messages.ALREADY_BOOKED, e);
            throw e;
        }
    }

    /** Deletes the caller's booking and returns the event it held, or null if that event is gone. */
    public PopulatedEvent cancel(String callerId, String bookingId) {
        Optional<Booking> current = bookingStore.findById(bookingId);
        if (guard.requireNotForbidden(current, Booking::getUser, callerId) == OwnershipCheck.NOT_FOUND) {
            throw new BadInputException(Messages.BOOKING_NOT_FOUND);
        }
        PopulatedEvent event = eventStore.findPopulated(current.get().getEvent()).orElse(null);
        if (!bookingStore.deleteIfOwner(bookingId, callerId)) {
            throw new BadInputException(Messages.BOOKING_NOT_FOUND);
        }
        log.info("booking.cancelled bookingId={} by={}", bookingId, callerId);
        return event;
    }
}

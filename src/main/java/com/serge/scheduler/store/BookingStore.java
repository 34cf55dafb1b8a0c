package com.serge.scheduler.store;

import com.serge.scheduler.domain.Booking;
import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.repo.BookingRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Sole access path to the {@code bookings} collection.
 */
@Component
@RequiredArgsConstructor
public class BookingStore {
    private static final Logger log = LoggerFactory.getLogger(BookingStore.class);

    private final BookingRepository bookings;
    private final EventStore eventStore;
    private final UserStore userStore;

    public Optional<Booking> findById(String id) {
        return bookings.findById(id);
    }

    public boolean exists(String userId, String eventId) {
        return bookings.existsByUserAndEvent(userId, eventId);
    }

    /** All bookings, newest first. */
    public List<PopulatedBooking> listAllPopulated() {
        return populate(bookings.findAll(Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    /**
     * Inserts a booking. A second booking of the same event by the same user is rejected by the
     * unique (user, event) index and surfaces as a duplicate-key {@link com.serge.scheduler.error.StoreException}.
     */
    public PopulatedBooking create(String eventId, String userId) {
        Booking booking = Booking.builder().event(eventId).user(userId).build();
        Booking saved = StoreErrors.write("create booking", () -> bookings.insert(booking));
        log.debug("store.booking.created bookingId={} eventId={} userId={}", saved.getId(), eventId, userId);
        return populate(List.of(saved)).get(0);
    }

    /** Deletes the booking only while it still belongs to {@code userId}. */
    public boolean deleteIfOwner(String id, String userId) {
        return StoreErrors.write("delete booking", () -> bookings.deleteByIdAndUser(id, userId)) > 0;
    }

    private List<PopulatedBooking> populate(List<Booking> list) {
        Set<String> eventIds = list.stream().map(Booking::getEvent).collect(Collectors.toSet());
        Set<String> userIds = list.stream().map(Booking::getUser).collect(Collectors.toSet());
        Map<String, PopulatedEvent> events = new HashMap<>();
        eventStore.populate(eventStore.findAllByIds(eventIds))
                .forEach(pe -> events.put(pe.getEvent().getId(), pe));
        Map<String, UserAccount> users = userStore.findByIds(userIds);
        return list.stream()
                .map(b -> new PopulatedBooking(b, events.get(b.getEvent()), users.get(b.getUser())))
                .collect(Collectors.toList());
    }
}

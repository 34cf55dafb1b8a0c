package com.serge.scheduler.repo;

import com.serge.scheduler.domain.Booking;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface BookingRepository extends MongoRepository<Booking, String> {

    boolean existsByUserAndEvent(String user, String event);

    long deleteByIdAndUser(String id, String user);
}

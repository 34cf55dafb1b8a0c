package com.serge.scheduler.repo;

import com.serge.scheduler.domain.Event;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface EventRepository extends MongoRepository<Event, String> {

    long deleteByIdAndCreatedBy(String id, String createdBy);
}

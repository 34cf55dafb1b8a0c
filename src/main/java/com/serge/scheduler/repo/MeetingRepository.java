package com.serge.scheduler.repo;

import com.serge.scheduler.domain.Meeting;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.Instant;
import java.util.List;

public interface MeetingRepository extends MongoRepository<Meeting, String> {

    @Query("{ '$or': [ { 'createdBy': ?0 }, { 'attendees': ?0 } ] }")
    List<Meeting> findForUser(String userId, Sort sort);

    /** Meetings overlapping [from, to]. */
    @Query("{ 'startTime': { '$lte': ?1 }, 'endTime': { '$gte': ?0 } }")
    List<Meeting> findOverlapping(Instant from, Instant to, Sort sort);

    long deleteByIdAndCreatedBy(String id, String createdBy);
}

package com.serge.scheduler.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Optional event read filters; a null field imposes no constraint. Date bounds are inclusive. */
@Value
@Builder
public class EventFilter {
    String createdById;
    Instant dateFrom;
    Instant dateTo;
}

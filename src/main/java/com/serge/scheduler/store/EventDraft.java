package com.serge.scheduler.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EventDraft {
    String title;
    String description;
    Instant date;
    double price;
}

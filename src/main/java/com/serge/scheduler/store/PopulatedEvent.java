package com.serge.scheduler.store;

import com.serge.scheduler.domain.Event;
import com.serge.scheduler.domain.UserAccount;
import lombok.Value;

@Value
public class PopulatedEvent {
    Event event;
    UserAccount createdBy;
}

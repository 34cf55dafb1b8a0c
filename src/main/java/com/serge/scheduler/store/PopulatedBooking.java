package com.serge.scheduler.store;

import com.serge.scheduler.domain.Booking;
import com.serge.scheduler.domain.UserAccount;
import lombok.Value;

@Value
public class PopulatedBooking {
    Booking booking;
    PopulatedEvent event;
    UserAccount user;
}

package com.serge.scheduler.store;

import com.serge.scheduler.domain.Meeting;
import com.serge.scheduler.domain.UserAccount;
import lombok.Value;

import java.util.List;

/** A meeting with its creator and attendees resolved. Attendees that no longer exist are dropped. */
@Value
public class PopulatedMeeting {
    Meeting meeting;
    UserAccount createdBy;
    List<UserAccount> attendees;
}

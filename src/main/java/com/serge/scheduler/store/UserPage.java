package com.serge.scheduler.store;

import com.serge.scheduler.domain.UserAccount;
import lombok.Value;

import java.util.List;

@Value
public class UserPage {
    List<UserAccount> users;
    long total;
    boolean hasMore;
}

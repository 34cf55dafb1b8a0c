package com.serge.scheduler.store;

import com.serge.scheduler.domain.Role;
import lombok.Builder;
import lombok.Value;

/** Administrative user update; null fields are left unchanged. */
@Value
@Builder
public class UserPatch {
    String name;
    String email;
    String imageUrl;
    Role role;
}

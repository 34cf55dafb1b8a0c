package com.serge.scheduler.input;

import com.serge.scheduler.domain.Role;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** {@code search} matches name or email. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsersWhere {
    private String search;
    private Role role;
}

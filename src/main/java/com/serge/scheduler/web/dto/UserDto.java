package com.serge.scheduler.web.dto;

import com.serge.scheduler.domain.Role;
import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.util.DateTimes;
import lombok.Value;

import java.util.List;

/** {@code createdEvents} is resolved separately from {@link #createdEventIds}. */
@Value
public class UserDto {
    String id;
    String name;
    String email;
    String imageUrl;
    String address;
    String dob;
    Role role;
    List<String> createdEventIds;
    String createdAt;
    String updatedAt;

    public static UserDto from(UserAccount u) {
        if (u == null) return null;
        return new UserDto(
                u.getId(),
                u.getName(),
                u.getEmail(),
                u.getImageUrl() == null ? "" : u.getImageUrl(),
                u.getAddress() == null ? "" : u.getAddress(),
                DateTimes.iso(u.getDob()),
                u.getRole() == null ? Role.USER : u.getRole(),
                u.getCreatedEvents() == null ? List.of() : List.copyOf(u.getCreatedEvents()),
                DateTimes.iso(u.getCreatedAt()),
                DateTimes.iso(u.getUpdatedAt()));
    }
}

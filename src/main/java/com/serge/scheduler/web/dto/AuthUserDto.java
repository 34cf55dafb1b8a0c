package com.serge.scheduler.web.dto;

import com.serge.scheduler.domain.UserAccount;
import lombok.Value;

/** Public identity projection; never carries the password hash. */
@Value
public class AuthUserDto {
    String id;
    String name;
    String email;
    String imageUrl;

    public static AuthUserDto from(UserAccount u) {
        return new AuthUserDto(u.getId(), u.getName(), u.getEmail(), u.getImageUrl() == null ? "" : u.getImageUrl());
    }
}

package com.serge.scheduler.web.dto;

import com.serge.scheduler.service.AuthService;
import lombok.Value;

@Value
public class AuthPayloadDto {
    String token;
    AuthUserDto user;
    /** Token lifetime in seconds. */
    long tokenExpiration;

    public static AuthPayloadDto from(AuthService.LoginResult r) {
        return new AuthPayloadDto(r.getToken(), AuthUserDto.from(r.getUser()), r.getExpiresInSeconds());
    }
}

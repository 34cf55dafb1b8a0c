package com.serge.scheduler.web;

import com.serge.scheduler.input.LoginInput;
import com.serge.scheduler.input.RegisterInput;
import com.serge.scheduler.service.AuthService;
import com.serge.scheduler.web.dto.AuthPayloadDto;
import com.serge.scheduler.web.dto.AuthUserDto;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

@Controller
@RequiredArgsConstructor
public class AuthController {
    private final AuthService authService;

    @MutationMapping
    public AuthUserDto register(@Argument RegisterInput input) {
        return AuthUserDto.from(authService.register(input));
    }

    @MutationMapping
    public AuthPayloadDto login(@Argument LoginInput input) {
        return AuthPayloadDto.from(authService.login(input));
    }

    @QueryMapping
    public AuthUserDto me(@ContextValue(name = Callers.CALLER_ID, required = false) String callerId) {
        return AuthUserDto.from(authService.me(Callers.require(callerId)));
    }
}

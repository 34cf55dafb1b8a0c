package com.serge.scheduler.service;

import com.serge.scheduler.domain.Role;
import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.error.*;
import com.serge.scheduler.input.LoginInput;
import com.serge.scheduler.input.RegisterInput;
import com.serge.scheduler.store.UserStore;
import com.serge.scheduler.validation.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

@Service
@RequiredArgsConstructor
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserStore userStore;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final InputValidator validator;

    @Value
    public static class LoginResult {
        String token;
        UserAccount user;
        long expiresInSeconds;
    }

    public UserAccount register(RegisterInput input) {
        validator.validate("register", input);
        log.info("auth.register email={}", input.getEmail());
        if (userStore.existsByEmail(input.getEmail())) {
            log.info("auth.register.duplicate email={}", input.getEmail());
            throw new ConflictException(Messages.EMAIL_IN_USE);
        }
        UserAccount user = UserAccount.builder()
                .name(input.getName().trim())
                .email(input.getEmail())
                .passwordHash(passwordEncoder.encode(input.getPassword()))
                .imageUrl("")
                .address("")
                .role(Role.USER)
                .createdEvents(new ArrayList<>())
                .build();
        try {
            UserAccount saved = userStore.create(user);
            log.info("auth.register.success userId={}", saved.getId());
            return saved;
        } catch (StoreException e) {
            // lost a race with a concurrent registration of the same address
            if (e.isDuplicateKey()) throw new ConflictException(Messages.EMAIL_IN_USE, e);
            throw e;
        }
    }

    public LoginResult login(LoginInput input) {
        validator.validate("login", input);
        UserAccount user = userStore.findByEmail(input.getEmail()).orElse(null);
        if (user == null || user.getPasswordHash() == null
                || !passwordEncoder.matches(input.getPassword(), user.getPasswordHash())) {
            log.info("auth.login.failed email={}", input.getEmail());
            throw new InvalidCredentialsException();
        }
        String token = tokenService.issue(user.getId());
        log.info("auth.login.success userId={}", user.getId());
        return new LoginResult(token, user, tokenService.ttl().getSeconds());
    }

    public UserAccount me(String callerId) {
        return userStore.findById(callerId).orElseThrow(UnauthenticatedException::new);
    }
}

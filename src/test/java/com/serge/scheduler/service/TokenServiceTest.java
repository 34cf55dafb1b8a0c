package com.serge.scheduler.service;

import com.serge.scheduler.error.ServerMisconfiguredException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenServiceTest {
    private static final String SECRET = "0123456789abcdef0123456789abcdef-test";

    @Test
    void issuedTokenAuthenticatesToItsUser() {
        TokenService tokens = new TokenService(SECRET, Duration.ofDays(7), Clock.systemUTC());

        String token = tokens.issue("65a1b2c3d4e5f60718293a4b");

        assertThat(tokens.authenticate(token)).contains("65a1b2c3d4e5f60718293a4b");
    }

    @Test
    void expiredTokenIsRejected() {
        Clock eightDaysAgo = Clock.fixed(Instant.now().minus(Duration.ofDays(8)), ZoneOffset.UTC);
        TokenService old = new TokenService(SECRET, Duration.ofDays(7), eightDaysAgo);
        TokenService now = new TokenService(SECRET, Duration.ofDays(7), Clock.systemUTC());

        assertThat(now.authenticate(old.issue("u1"))).isEmpty();
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        TokenService other = new TokenService("another-secret-another-secret-xyz", Duration.ofDays(7), Clock.systemUTC());
        TokenService tokens = new TokenService(SECRET, Duration.ofDays(7), Clock.systemUTC());

        assertThat(tokens.authenticate(other.issue("u1"))).isEmpty();
    }

    @Test
    void malformedOrMissingTokensAreRejected() {
        TokenService tokens = new TokenService(SECRET, Duration.ofDays(7), Clock.systemUTC());

        assertThat(tokens.authenticate(null)).isEmpty();
        assertThat(tokens.authenticate("")).isEmpty();
        assertThat(tokens.authenticate("not.a.jwt")).isEmpty();
    }

    @Test
    void withoutSecretNothingIsIssuedOrAccepted() {
        TokenService tokens = new TokenService("", Duration.ofDays(7), Clock.systemUTC());

        assertThat(tokens.isConfigured()).isFalse();
        assertThatThrownBy(() -> tokens.issue("u1"))
                .isInstanceOf(ServerMisconfiguredException.class)
                .hasMessage("Server misconfiguration: JWT secret missing");
        assertThat(tokens.authenticate("anything")).isEmpty();
    }
}

package com.serge.scheduler.service;

import com.serge.scheduler.domain.Role;
import com.serge.scheduler.domain.UserAccount;
import com.serge.scheduler.error.*;
import com.serge.scheduler.input.LoginInput;
import com.serge.scheduler.input.RegisterInput;
import com.serge.scheduler.store.UserStore;
import com.serge.scheduler.validation.InputValidator;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {
    private static final String SECRET = "0123456789abcdef0123456789abcdef-test";

    @Mock
    private UserStore userStore;

    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private final InputValidator validator = new InputValidator(Validation.buildDefaultValidatorFactory().getValidator());
    private TokenService tokenService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        tokenService = new TokenService(SECRET, Duration.ofDays(7), Clock.systemUTC());
        authService = new AuthService(userStore, encoder, tokenService, validator);
    }

    private UserAccount storedAlice() {
        return UserAccount.builder()
                .id("u-alice")
                .name("Alice")
                .email("alice@example.com")
                .passwordHash(encoder.encode("Abcdef1!"))
                .role(Role.USER)
                .build();
    }

    @Test
    void registerHashesThePasswordAndStoresTheUser() {
        when(userStore.existsByEmail("alice@example.com")).thenReturn(false);
        when(userStore.create(any(UserAccount.class))).thenAnswer(inv -> {
            UserAccount u = inv.getArgument(0);
            u.setId("u-alice");
            return u;
        });

        UserAccount created = authService.register(new RegisterInput(" Alice ", "alice@example.com", "Abcdef1!"));

        ArgumentCaptor<UserAccount> saved = ArgumentCaptor.forClass(UserAccount.class);
        verify(userStore).create(saved.capture());
        assertThat(created.getId()).isEqualTo("u-alice");
        assertThat(saved.getValue().getName()).isEqualTo("Alice");
        assertThat(saved.getValue().getRole()).isEqualTo(Role.USER);
        assertThat(saved.getValue().getPasswordHash()).isNotEqualTo("Abcdef1!");
        assertThat(encoder.matches("Abcdef1!", saved.getValue().getPasswordHash())).isTrue();
    }

    @Test
    void registerWithUsedEmailIsAConflictAndCreatesNothing() {
        when(userStore.existsByEmail("alice@example.com")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(new RegisterInput("Alice", "alice@example.com", "Abcdef1!")))
                .isInstanceOf(ConflictException.class)
                .hasMessage(Messages.EMAIL_IN_USE);
        verify(userStore, never()).create(any());
    }

    @Test
    void registerRaceOnTheUniqueIndexIsAlsoAConflict() {
        when(userStore.existsByEmail("alice@example.com")).thenReturn(false);
        when(userStore.create(any(UserAccount.class)))
                .thenThrow(new StoreException(Messages.DUPLICATE_KEY, true, null));

        assertThatThrownBy(() -> authService.register(new RegisterInput("Alice", "alice@example.com", "Abcdef1!")))
                .isInstanceOf(ConflictException.class)
                .hasMessage(Messages.EMAIL_IN_USE);
    }

    @Test
    void invalidRegistrationNeverReachesTheStore() {
        assertThatThrownBy(() -> authService.register(new RegisterInput("A", "alice", "weak")))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getDetails()).isNotEmpty());
        verifyNoInteractions(userStore);
    }

    @Test
    void loginIssuesATokenThatAuthenticates() {
        when(userStore.findByEmail("alice@example.com")).thenReturn(Optional.of(storedAlice()));

        AuthService.LoginResult result = authService.login(new LoginInput("alice@example.com", "Abcdef1!"));

        assertThat(result.getUser().getId()).isEqualTo("u-alice");
        assertThat(result.getExpiresInSeconds()).isEqualTo(Duration.ofDays(7).getSeconds());
        assertThat(tokenService.authenticate(result.getToken())).contains("u-alice");
    }

    @Test
    void unknownEmailAndWrongPasswordFailTheSameWay() {
        when(userStore.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        when(userStore.findByEmail("alice@example.com")).thenReturn(Optional.of(storedAlice()));

        assertThatThrownBy(() -> authService.login(new LoginInput("nobody@example.com", "Abcdef1!")))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage(Messages.INVALID_CREDENTIALS);
        assertThatThrownBy(() -> authService.login(new LoginInput("alice@example.com", "Wrong123!")))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage(Messages.INVALID_CREDENTIALS);
    }

    @Test
    void loginWithoutSigningSecretIsAServerMisconfiguration() {
        AuthService unsigned = new AuthService(userStore, encoder,
                new TokenService("", Duration.ofDays(7), Clock.systemUTC()), validator);
        when(userStore.findByEmail("alice@example.com")).thenReturn(Optional.of(storedAlice()));

        assertThatThrownBy(() -> unsigned.login(new LoginInput("alice@example.com", "Abcdef1!")))
                .isInstanceOf(ServerMisconfiguredException.class)
                .extracting(e -> ((ApiException) e).getCode())
                .isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR);
    }
}

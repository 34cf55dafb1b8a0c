package com.serge.scheduler.service;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.serge.scheduler.error.Messages;
import com.serge.scheduler.error.ServerMisconfiguredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and verifies HS256 bearer tokens carrying the user id. Without a usable secret no token is
 * issued and every token is rejected.
 */
@Service
public class TokenService {
    private static final Logger log = LoggerFactory.getLogger(TokenService.class);
    static final int MIN_SECRET_BYTES = 32;
    static final String USER_ID_CLAIM = "userId";

    private final JwtEncoder encoder;
    private final JwtDecoder decoder;
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public TokenService(@Value("${scheduler.jwt.secret:}") String secret,
                        @Value("${scheduler.jwt.ttl:P7D}") Duration ttl) {
        this(secret, ttl, Clock.systemUTC());
    }

    TokenService(String secret, Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        byte[] bytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            log.warn("auth.jwt.secret_unusable length={} required={}", bytes.length, MIN_SECRET_BYTES);
            this.encoder = null;
            this.decoder = null;
            return;
        }
        SecretKey key = new SecretKeySpec(bytes, "HmacSHA256");
        this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
        NimbusJwtDecoder nimbus = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
        nimbus.setJwtValidator(new JwtTimestampValidator(Duration.ZERO));
        this.decoder = nimbus;
    }

    public boolean isConfigured() {
        return encoder != null;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * @throws ServerMisconfiguredException when no signing secret is configured
     */
    public String issue(String userId) {
        if (encoder == null) throw new ServerMisconfiguredException(Messages.JWT_MISSING);
        Instant now = clock.instant();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject(userId)
                .claim(USER_ID_CLAIM, userId)
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String token = encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        log.debug("auth.token.issued userId={} expiresAt={}", userId, claims.getExpiresAt());
        return token;
    }

    /**
     * Caller id for a valid token. Missing, malformed, expired and badly signed tokens all come back
     * empty; the reason is only logged.
     */
    public Optional<String> authenticate(String token) {
        if (decoder == null || token == null || token.isBlank()) return Optional.empty();
        try {
            Jwt jwt = decoder.decode(token);
            String userId = jwt.getClaimAsString(USER_ID_CLAIM);
            return Optional.ofNullable(userId != null ? userId : jwt.getSubject());
        } catch (JwtException e) {
            log.debug("auth.token.rejected reason={}", e.getMessage());
            return Optional.empty();
        }
    }
}

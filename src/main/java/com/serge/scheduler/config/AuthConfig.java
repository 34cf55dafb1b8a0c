package com.serge.scheduler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class AuthConfig {

    /** Cost factor 12 unless overridden; tests run with 4. */
    @Bean
    PasswordEncoder passwordEncoder(@Value("${scheduler.bcrypt.strength:12}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}

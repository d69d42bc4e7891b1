package com.cardiorecords.infrastructure.security;

import com.cardiorecords.config.PhiSecurityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt {@link PasswordVerifier} with configurable cost.
 */
@Component
@Slf4j
public class BCryptPasswordVerifier implements PasswordVerifier {

    private final BCryptPasswordEncoder encoder;
    private final String dummyHash;

    @Autowired
    public BCryptPasswordVerifier(PhiSecurityProperties properties) {
        this(properties.getPassword().getBcryptStrength());
    }

    public BCryptPasswordVerifier(int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
        this.dummyHash = encoder.encode("dummy-password-for-timing");
        log.info("Password verifier initialised: bcrypt strength={}", strength);
    }

    @Override
    public String hash(String rawPassword) {
        return encoder.encode(rawPassword);
    }

    @Override
    public boolean matches(String rawPassword, String storedHash) {
        if (rawPassword == null || storedHash == null) {
            return false;
        }
        return encoder.matches(rawPassword, storedHash);
    }

    @Override
    public void dummyCompare(String rawPassword) {
        encoder.matches(rawPassword == null ? "" : rawPassword, dummyHash);
    }
}

package com.hamco.api.serviceImpl;

import com.hamco.api.service.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class BCryptPasswordHasher implements PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    @Override
    public String hash(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext is required");
        return passwordEncoder.encode(plaintext);
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            // Unparseable salt/cost in the stored value
            log.debug("Stored hash could not be parsed: {}", e.getMessage());
            return false;
        }
    }
}

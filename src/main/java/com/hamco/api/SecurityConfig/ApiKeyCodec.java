package com.hamco.api.SecurityConfig;

import com.hamco.api.service.PasswordHasher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Plaintext API key format: {@code hk_<43 base64url chars>} (32 random bytes).
 * <p>
 * The first {@value #PREFIX_LENGTH} characters double as the stored lookup prefix, so the marker is
 * kept short enough that the prefix still carries random characters. Total length stays under
 * BCrypt's 72-byte input limit.
 */
@Component
@RequiredArgsConstructor
public class ApiKeyCodec {

    public static final String MARKER = "hk_";
    public static final int PREFIX_LENGTH = 8;
    static final int RANDOM_BYTES = 32;
    static final int MIN_PAYLOAD_LENGTH = 32;

    private final PasswordHasher hasher;
    private final SecureRandom random = new SecureRandom();

    public String generate() {
        byte[] buf = new byte[RANDOM_BYTES];
        random.nextBytes(buf);
        return MARKER + Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    /** Display/lookup prefix. Never sufficient on its own to authorize anything. */
    public String derivePrefix(String secret) {
        if (secret == null || secret.length() < PREFIX_LENGTH) {
            throw new IllegalArgumentException("API key too short to derive a prefix");
        }
        return secret.substring(0, PREFIX_LENGTH);
    }

    public String hash(String secret) {
        return hasher.hash(secret);
    }

    public boolean verify(String secret, String hash) {
        return hasher.verify(secret, hash);
    }

    /** Cheap shape check run before any cache or storage access. */
    public boolean isWellFormed(String secret) {
        if (secret == null || secret.isBlank()) return false;
        if (!secret.startsWith(MARKER)) return false;
        return secret.length() - MARKER.length() >= MIN_PAYLOAD_LENGTH;
    }
}

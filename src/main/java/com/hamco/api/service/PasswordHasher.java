package com.hamco.api.service;

/**
 * One-way, salted, deliberately slow hashing for secrets at rest (passwords and API keys).
 */
public interface PasswordHasher {

    String hash(String plaintext);

    /** Never throws; a null or malformed stored hash simply does not match. */
    boolean verify(String plaintext, String hash);
}

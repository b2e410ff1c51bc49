package com.hamco.api.model;

import java.time.Instant;

/** A freshly signed bearer token plus the metadata the login response echoes back. */
public record IssuedToken(String token, String tokenId, Instant issuedAt, Instant expiresAt) {
}

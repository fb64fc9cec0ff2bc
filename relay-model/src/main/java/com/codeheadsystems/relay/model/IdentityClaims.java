package com.codeheadsystems.relay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public claims of an authenticated identity, taken from the verified token.
 * <p>
 * Sent back to the client in {@code auth_success}.
 *
 * @param id    durable user identifier; names the participant in stored conversations
 * @param email unique email address; the key under which the identity is present
 * @param role  application role, may be null
 */
public record IdentityClaims(
    @JsonProperty("id") String id,
    @JsonProperty("email") String email,
    @JsonProperty("role") String role) {
}

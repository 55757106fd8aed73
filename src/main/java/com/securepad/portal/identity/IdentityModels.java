package com.securepad.portal.identity;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public class IdentityModels {
    /**
     * Authenticated caller. Every core operation receives it explicitly from the HTTP boundary.
     */
    public record Principal(String id, Role role) {
        @JsonIgnore
        public boolean isAdmin() {
            return role == Role.ADMIN;
        }
    }

    public record UserAccount(String id, String handle, String email, Role role, Instant createdAt) {}

    public record UserRef(String id, String handle, String email) {}

    public record IssuedToken(String token, String userId, Instant expiresAt) {}
}

package com.teamA.cra.api.auth;

/**
 * SecurityContext principal (JWT claim 그대로)
 */
public record AuthenticatedUser(String userId, String name, String role) {

    @Override
    public String toString() {
        return userId;
    }
}

package io.catalogsync.domain;

/**
 * An authenticated catalog session.
 */
public record Session(String username, String token) {
    public Session {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be blank");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be blank");
        }
    }
}

package io.catalogsync.domain;

/**
 * Username and password for the catalog.
 */
public record Credentials(String username, String password) {
    public Credentials {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be blank");
        }
        password = password != null ? password : "";
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + "]";
    }
}

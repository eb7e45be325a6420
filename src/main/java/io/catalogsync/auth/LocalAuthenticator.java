package io.catalogsync.auth;

import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.Credentials;
import io.catalogsync.domain.Session;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Optional;
import java.util.UUID;

/**
 * Authenticator for the local catalog mirror.
 * Checks the configured username and password when set, otherwise accepts any user.
 */
@ApplicationScoped
public class LocalAuthenticator implements Authenticator {

    private final Optional<String> expectedUsername;
    private final Optional<String> expectedPassword;

    @Inject
    public LocalAuthenticator(SyncConfig config) {
        this(config.auth().username(), config.auth().password());
    }

    public LocalAuthenticator(Optional<String> expectedUsername, Optional<String> expectedPassword) {
        this.expectedUsername = expectedUsername;
        this.expectedPassword = expectedPassword;
    }

    @Override
    public Session login(Credentials credentials) throws AuthException {
        if (expectedUsername.isPresent() && !expectedUsername.get().equals(credentials.username())) {
            throw new AuthException("Unknown user: " + credentials.username());
        }
        if (expectedPassword.isPresent() && !expectedPassword.get().equals(credentials.password())) {
            throw new AuthException("Wrong password for " + credentials.username());
        }
        return new Session(credentials.username(), UUID.randomUUID().toString());
    }
}

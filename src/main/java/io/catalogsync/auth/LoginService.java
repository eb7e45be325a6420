package io.catalogsync.auth;

import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.Credentials;
import io.catalogsync.domain.Session;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.function.Supplier;

/**
 * Logs in with a bounded number of attempts.
 * The credentials supplier is asked again before every attempt.
 */
@ApplicationScoped
public class LoginService {

    private static final Logger LOG = Logger.getLogger(LoginService.class);

    private final Authenticator authenticator;
    private final int maxAttempts;

    @Inject
    public LoginService(Authenticator authenticator, SyncConfig config) {
        this(authenticator, config.auth().maxAttempts());
    }

    public LoginService(Authenticator authenticator, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.authenticator = authenticator;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws AuthException the failure of the last attempt once all attempts are spent
     */
    public Session login(Supplier<Credentials> credentials) throws AuthException {
        AuthException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Credentials current = credentials.get();
            try {
                Session session = authenticator.login(current);
                LOG.debugf("Logged in as %s on attempt %d", current.username(), attempt);
                return session;
            } catch (AuthException e) {
                LOG.warnf("Login attempt %d/%d for %s failed: %s",
                        attempt, maxAttempts, current.username(), e.getMessage());
                last = e;
            }
        }

        throw last;
    }
}

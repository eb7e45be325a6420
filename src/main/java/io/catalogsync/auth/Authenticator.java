package io.catalogsync.auth;

import io.catalogsync.domain.Credentials;
import io.catalogsync.domain.Session;

public interface Authenticator {
    Session login(Credentials credentials) throws AuthException;
}

package io.triage.sdk.auth;

import java.util.Objects;
import java.util.Optional;

/**
 * Supplies the {@code Authorization} header for outbound requests. The store is read at send time, so a request built
 * before a refresh carries the rotated token when it is replayed.
 */
public final class CredentialAttacher {

    private final CredentialStore store;

    public CredentialAttacher(CredentialStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @return the bearer token to send, or {@code null} to rely on the session cookie alone.
     */
    public String bearerToken() {
        return store.accessToken();
    }

    public Optional<String> authorizationHeader() {
        return Optional.ofNullable(bearerToken()).map(token -> "Bearer " + token);
    }
}

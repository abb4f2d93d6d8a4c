package io.triage.sdk.session;

import io.triage.sdk.auth.CredentialStore;

import java.net.CookieStore;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ends the local session: clears the credential store (which empties the session mirror with it) and the cookie
 * jar, then sends the user to the login entry point.
 *
 * <p>Teardown is idempotent and never throws. Each step is best-effort; a failing step is logged and the remaining
 * steps still run. Invocations are serialised, so concurrent calls navigate at most once.</p>
 */
public final class SessionTeardown {

    private static final Logger LOGGER = Logger.getLogger(SessionTeardown.class.getName());

    public static final String DEFAULT_LOGIN_PATH = "/login";

    private final CredentialStore store;
    private final CookieStore cookies;
    private final Navigator navigator;
    private final String loginPath;

    private final Object lock = new Object();

    public SessionTeardown(CredentialStore store, CookieStore cookies, Navigator navigator, String loginPath) {
        this.store = Objects.requireNonNull(store, "store");
        this.cookies = cookies;
        this.navigator = Objects.requireNonNull(navigator, "navigator");
        this.loginPath = loginPath == null || loginPath.isBlank() ? DEFAULT_LOGIN_PATH : loginPath;
    }

    public void teardown() {
        synchronized (lock) {
            store.clear().ifPresent(previous ->
                LOGGER.info(() -> "[triage-sdk] tearing down session of user " + previous.getUser().id()));

            if (cookies != null) {
                try {
                    cookies.removeAll();
                } catch (RuntimeException ex) {
                    LOGGER.log(Level.WARNING, "[triage-sdk] unable to clear session cookies", ex);
                }
            }

            try {
                if (!isAtLogin(navigator.currentLocation())) {
                    LOGGER.info(() -> "[triage-sdk] redirecting to " + loginPath);
                    navigator.navigate(loginPath);
                }
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[triage-sdk] unable to navigate to " + loginPath, ex);
            }
        }
    }

    public String getLoginPath() {
        return loginPath;
    }

    private boolean isAtLogin(String location) {
        if (location == null) {
            return false;
        }
        String path = location;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0) {
            path = path.substring(0, fragment);
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return loginPath.equals(path);
    }
}

package io.triage.sdk;

import io.triage.sdk.gateway.FailureClassifier;
import io.triage.sdk.session.InMemorySessionMirror;
import io.triage.sdk.session.Navigator;
import io.triage.sdk.session.RecordingNavigator;
import io.triage.sdk.session.SessionMirror;
import io.triage.sdk.session.SessionTeardown;

import java.net.CookieHandler;
import java.net.CookieManager;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link TriageClient} instances.
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "http://localhost:8000";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final CookieManager cookieManager;
    private final Duration httpTimeout;
    private final String loginPath;
    private final List<String> exemptPaths;
    private final SessionMirror sessionMirror;
    private final Navigator navigator;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.httpClient = builder.httpClient;
        this.cookieManager = builder.cookieManager;
        this.httpTimeout = builder.httpTimeout;
        this.loginPath = builder.loginPath;
        this.exemptPaths = builder.exemptPaths == null ? null : new ArrayList<>(builder.exemptPaths);
        this.sessionMirror = builder.sessionMirror;
        this.navigator = builder.navigator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(DEFAULT_BASE_URL));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        String resolvedLoginPath = Optional.ofNullable(loginPath)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(SessionTeardown.DEFAULT_LOGIN_PATH);
        if (!resolvedLoginPath.startsWith("/")) {
            throw new IllegalArgumentException("LoginPath must start with '/'");
        }

        List<String> resolvedExemptPaths;
        if (exemptPaths == null) {
            resolvedExemptPaths = FailureClassifier.DEFAULT_EXEMPT_PATHS;
        } else {
            resolvedExemptPaths = exemptPaths.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        }

        HttpClient resolvedClient = httpClient;
        CookieManager resolvedCookies = cookieManager;
        if (resolvedClient == null) {
            if (resolvedCookies == null) {
                resolvedCookies = new CookieManager();
            }
            resolvedClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(resolvedTimeout)
                .cookieHandler(resolvedCookies)
                .build();
        } else if (resolvedCookies == null) {
            CookieHandler handler = resolvedClient.cookieHandler().orElse(null);
            if (handler instanceof CookieManager manager) {
                resolvedCookies = manager;
            }
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .httpClient(resolvedClient)
            .cookieManager(resolvedCookies)
            .httpTimeout(resolvedTimeout)
            .loginPath(resolvedLoginPath)
            .exemptPaths(resolvedExemptPaths)
            .sessionMirror(Optional.ofNullable(sessionMirror).orElseGet(InMemorySessionMirror::new))
            .navigator(Optional.ofNullable(navigator).orElseGet(RecordingNavigator::new))
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * @return the cookie jar holding the session cookies, or {@code null} when the supplied client has none.
     */
    public CookieManager getCookieManager() {
        return cookieManager;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getLoginPath() {
        return loginPath;
    }

    public List<String> getExemptPaths() {
        return exemptPaths == null ? List.of() : List.copyOf(exemptPaths);
    }

    public SessionMirror getSessionMirror() {
        return sessionMirror;
    }

    public Navigator getNavigator() {
        return navigator;
    }

    public static final class Builder {
        private String baseUrl;
        private HttpClient httpClient;
        private CookieManager cookieManager;
        private Duration httpTimeout;
        private String loginPath;
        private List<String> exemptPaths;
        private SessionMirror sessionMirror;
        private Navigator navigator;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder cookieManager(CookieManager cookieManager) {
            this.cookieManager = cookieManager;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder loginPath(String loginPath) {
            this.loginPath = loginPath;
            return this;
        }

        public Builder exemptPaths(List<String> exemptPaths) {
            this.exemptPaths = exemptPaths == null ? null : new ArrayList<>(exemptPaths);
            return this;
        }

        public Builder sessionMirror(SessionMirror sessionMirror) {
            this.sessionMirror = sessionMirror;
            return this;
        }

        public Builder navigator(Navigator navigator) {
            this.navigator = navigator;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}

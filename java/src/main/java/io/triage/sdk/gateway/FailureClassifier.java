package io.triage.sdk.gateway;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a failed request is an expired session that the {@link RefreshCoordinator} may recover.
 *
 * <p>Auth endpoints are exempt, otherwise a rejected login would trigger a refresh, and a request that was already
 * replayed once is never eligible again.</p>
 */
public final class FailureClassifier {

    public static final int SESSION_EXPIRED_STATUS = 401;
    public static final List<String> DEFAULT_EXEMPT_PATHS = List.of("/auth/login", "/auth/register", "/auth/refresh");

    private final List<String> exemptPaths;

    public FailureClassifier() {
        this(DEFAULT_EXEMPT_PATHS);
    }

    public FailureClassifier(List<String> exemptPaths) {
        this.exemptPaths = List.copyOf(Objects.requireNonNull(exemptPaths, "exemptPaths"));
    }

    public FailureKind classify(ApiRequest request, int statusCode) {
        return classify(request.path(), statusCode, request.retried());
    }

    public FailureKind classify(String path, int statusCode, boolean retried) {
        if (statusCode != SESSION_EXPIRED_STATUS) {
            return FailureKind.OTHER_FAILURE;
        }
        if (isExempt(path)) {
            return FailureKind.AUTH_ENDPOINT_FAILURE;
        }
        if (retried) {
            return FailureKind.RETRY_EXHAUSTED;
        }
        return FailureKind.SESSION_EXPIRED;
    }

    public boolean isExempt(String path) {
        if (path == null) {
            return false;
        }
        for (String fragment : exemptPaths) {
            if (path.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getExemptPaths() {
        return exemptPaths;
    }
}

package io.triage.sdk.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import io.triage.sdk.TriageException;
import io.triage.sdk.gateway.ApiGateway;
import io.triage.sdk.gateway.ApiRequest;
import io.triage.sdk.gateway.ApiResponse;
import io.triage.sdk.internal.Json;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Session lifecycle endpoints of the API gateway: sign-in, sign-up, sign-out and the project list.
 */
public final class AuthApi {

    private static final Logger LOGGER = Logger.getLogger(AuthApi.class.getName());

    public static final String LOGIN_PATH = "/api/v1/auth/login";
    public static final String REGISTER_PATH = "/api/v1/auth/register";
    public static final String PROJECTS_PATH = "/api/v1/projects";

    private final ApiGateway gateway;
    private final CredentialStore store;
    private final SessionLogout sessionLogout;

    public AuthApi(ApiGateway gateway, CredentialStore store, SessionLogout sessionLogout) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.store = Objects.requireNonNull(store, "store");
        this.sessionLogout = Objects.requireNonNull(sessionLogout, "sessionLogout");
    }

    /**
     * Signs in and establishes the session.
     *
     * @throws io.triage.sdk.TriageApiException with kind {@code AUTH_ENDPOINT_FAILURE} for rejected credentials.
     */
    public Credential login(String email, String password) throws TriageException {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password is required");
        }
        ApiResponse response = gateway.send(ApiRequest.post(LOGIN_PATH, Map.of("email", email, "password", password)));
        return establish(response.as(AuthResponse.class));
    }

    /**
     * Creates a tenant and user, then establishes the session exactly like {@link #login(String, String)}.
     */
    public Credential register(RegistrationRequest request) throws TriageException {
        Objects.requireNonNull(request, "request");
        ApiResponse response = gateway.send(ApiRequest.post(REGISTER_PATH, request));
        return establish(response.as(AuthResponse.class));
    }

    /**
     * Signs out. See {@link SessionLogout}: the local session ends even when the gateway call fails.
     */
    public void logout() {
        sessionLogout.logout();
    }

    /**
     * Reloads the projects the user belongs to and replaces the list held by the credential.
     */
    public List<Project> reloadProjects() throws TriageException {
        if (!store.isAuthenticated()) {
            throw new TriageException("no active session");
        }
        ApiResponse response = gateway.send(ApiRequest.get(PROJECTS_PATH));
        List<Project> projects;
        try {
            projects = Json.mapper().readValue(response.getBody(), new TypeReference<List<Project>>() {
            });
        } catch (IOException ex) {
            throw new TriageException("decode projects response: " + ex.getMessage(), ex);
        }
        if (!store.replaceProjects(projects)) {
            throw new TriageException("session ended while reloading projects");
        }
        LOGGER.info(() -> "[triage-sdk] loaded " + projects.size() + " project(s)");
        return projects;
    }

    private Credential establish(AuthResponse body) throws TriageException {
        if (body.accessToken() == null || body.accessToken().isBlank()) {
            throw new TriageException("auth response missing access_token");
        }
        if (body.user() == null) {
            throw new TriageException("auth response missing user");
        }
        Credential credential = Credential.issued(body.accessToken(), body.user(), body.projects());
        store.establish(credential);
        return credential;
    }

    record AuthResponse(String accessToken, String tokenType, UserProfile user, List<Project> projects) {
    }
}

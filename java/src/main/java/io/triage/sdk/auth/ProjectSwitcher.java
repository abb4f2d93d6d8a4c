package io.triage.sdk.auth;

import io.triage.sdk.TriageException;
import io.triage.sdk.gateway.ApiGateway;
import io.triage.sdk.gateway.ApiRequest;
import io.triage.sdk.gateway.ApiResponse;

import java.util.Objects;

/**
 * Changes the active project and rotates the credential.
 *
 * <p>A rejected switch leaves the store untouched and never ends the session: it is not an expired-session
 * condition. Requests already in flight finish with the credential they were sent with.</p>
 */
public final class ProjectSwitcher {

    public static final String SWITCH_PATH = "/api/v1/auth/switch-project";

    private final ApiGateway gateway;
    private final CredentialStore store;

    public ProjectSwitcher(ApiGateway gateway, CredentialStore store) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @param projectId a project listed in the current credential and marked active.
     * @return the credential now in the store.
     * @throws TriageException when the project is unknown or inactive, when there is no session, or when the gateway
     *                         rejects the switch ({@link io.triage.sdk.TriageApiException}).
     */
    public Credential switchTo(String projectId) throws TriageException {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        Credential current = store.current().orElseThrow(() -> new TriageException("no active session"));
        Project target = current.findProject(projectId)
            .orElseThrow(() -> new TriageException("project " + projectId + " is not available to this user"));
        if (!target.active()) {
            throw new TriageException("project " + projectId + " is not active");
        }
        if (current.getActiveProject().map(Project::id).filter(projectId::equals).isPresent()) {
            return current;
        }

        ApiResponse response = gateway.send(ApiRequest.post(SWITCH_PATH, new SwitchRequest(projectId)));
        SwitchResponse body = response.as(SwitchResponse.class);
        if (body.accessToken() == null || body.accessToken().isBlank()) {
            throw new TriageException("switch-project response missing access_token");
        }
        if (body.project() == null || !projectId.equals(body.project().id())) {
            throw new TriageException("switch-project response does not describe project " + projectId);
        }
        return store.switchProject(body.accessToken(), body.project());
    }

    private record SwitchRequest(String projectId) {
    }

    record SwitchResponse(String accessToken, Project project) {
    }
}

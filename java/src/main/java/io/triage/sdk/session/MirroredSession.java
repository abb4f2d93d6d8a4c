package io.triage.sdk.session;

import io.triage.sdk.auth.Credential;
import io.triage.sdk.auth.Project;
import io.triage.sdk.auth.UserProfile;

import java.time.Instant;
import java.util.List;

/**
 * Non-sensitive subset of a credential kept across restarts. The bearer token is never part of it.
 */
public record MirroredSession(
    UserProfile user,
    List<Project> projects,
    Project currentProject,
    boolean authenticated,
    Instant savedAt
) {

    public static MirroredSession of(Credential credential) {
        return new MirroredSession(
            credential.getUser(),
            credential.getProjects(),
            credential.getActiveProject().orElse(null),
            true,
            Instant.now()
        );
    }
}

package io.triage.sdk.auth;

/**
 * Identity context returned by the auth endpoints.
 */
public record UserProfile(
    String id,
    String email,
    String fullName,
    String role,
    String tenantId,
    String tenantName,
    String currentProjectId,
    String currentProjectRole
) {

    public UserProfile withCurrentProject(Project project) {
        if (project == null) {
            return new UserProfile(id, email, fullName, role, tenantId, tenantName, null, null);
        }
        return new UserProfile(id, email, fullName, role, tenantId, tenantName, project.id(), project.role());
    }
}

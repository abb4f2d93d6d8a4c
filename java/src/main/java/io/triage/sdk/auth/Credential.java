package io.triage.sdk.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The bearer token plus the identity and tenant context used to authorise outbound calls.
 *
 * <p>Instances are immutable and always fully populated: the token is non-blank and the user is present. Changes
 * produce a new instance which {@link CredentialStore} swaps in atomically.</p>
 */
public final class Credential {

    private final String accessToken;
    private final UserProfile user;
    private final Project activeProject;
    private final List<Project> projects;

    public Credential(String accessToken, UserProfile user, Project activeProject, List<Project> projects) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken is required");
        }
        this.accessToken = accessToken;
        this.user = Objects.requireNonNull(user, "user");
        this.activeProject = activeProject;
        this.projects = projects == null ? List.of() : List.copyOf(projects);
    }

    /**
     * Builds the credential issued by login or registration. The active project is the one named by
     * {@link UserProfile#currentProjectId()}, falling back to the first project.
     */
    public static Credential issued(String accessToken, UserProfile user, List<Project> projects) {
        List<Project> available = projects == null ? List.of() : projects;
        Project active = null;
        if (user != null && user.currentProjectId() != null) {
            active = available.stream()
                .filter(p -> user.currentProjectId().equals(p.id()))
                .findFirst()
                .orElse(null);
        }
        if (active == null && !available.isEmpty()) {
            active = available.get(0);
        }
        return new Credential(accessToken, user, active, available);
    }

    public String getAccessToken() {
        return accessToken;
    }

    public UserProfile getUser() {
        return user;
    }

    public Optional<Project> getActiveProject() {
        return Optional.ofNullable(activeProject);
    }

    public List<Project> getProjects() {
        return projects;
    }

    public Optional<Project> findProject(String projectId) {
        if (projectId == null) {
            return Optional.empty();
        }
        return projects.stream().filter(p -> projectId.equals(p.id())).findFirst();
    }

    /**
     * Token rotated by a refresh; identity and projects stay intact.
     */
    public Credential withAccessToken(String token) {
        return new Credential(token, user, activeProject, projects);
    }

    /**
     * Token and active project replaced together by a project switch.
     */
    public Credential withSwitchedProject(String token, Project project) {
        Objects.requireNonNull(project, "project");
        List<Project> updated = projects.stream()
            .map(p -> p.id().equals(project.id()) ? project : p)
            .toList();
        if (findProject(project.id()).isEmpty()) {
            updated = new ArrayList<>(updated);
            updated.add(project);
        }
        return new Credential(token, user.withCurrentProject(project), project, updated);
    }

    /**
     * Replaces the project list. The active project is kept when it is still listed.
     */
    public Credential withProjects(List<Project> replacement) {
        List<Project> list = replacement == null ? List.of() : replacement;
        Project active = activeProject == null ? null : list.stream()
            .filter(p -> p.id().equals(activeProject.id()))
            .findFirst()
            .orElse(null);
        return new Credential(accessToken, user, active, list);
    }

    @Override
    public String toString() {
        return "Credential{user=" + user.id()
            + ", activeProject=" + (activeProject == null ? null : activeProject.id())
            + ", projects=" + projects.size() + "}";
    }
}

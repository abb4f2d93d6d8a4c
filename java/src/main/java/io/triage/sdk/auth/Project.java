package io.triage.sdk.auth;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Project the signed-in user may switch into. The gateway reports the caller's role either as {@code role} (auth
 * endpoints) or {@code current_user_role} (projects API).
 */
public record Project(
    String id,
    String name,
    String slug,
    @JsonAlias("current_user_role") String role,
    @JsonProperty("is_active") boolean active
) {
}

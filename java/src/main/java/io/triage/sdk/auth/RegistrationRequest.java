package io.triage.sdk.auth;

/**
 * Sign-up payload; creates a tenant with the caller as its first admin.
 */
public record RegistrationRequest(String email, String password, String fullName, String tenantName) {
}

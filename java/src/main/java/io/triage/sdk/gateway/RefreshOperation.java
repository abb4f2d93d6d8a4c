package io.triage.sdk.gateway;

import io.triage.sdk.TriageException;

/**
 * The single network call that renews the session.
 */
@FunctionalInterface
public interface RefreshOperation {

    void refresh() throws TriageException;
}

package io.triage.sdk.session;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mirror kept in process memory; the default when no storage location is configured.
 */
public final class InMemorySessionMirror implements SessionMirror {

    private final AtomicReference<MirroredSession> stored = new AtomicReference<>();

    @Override
    public void save(MirroredSession session) {
        stored.set(session);
    }

    @Override
    public Optional<MirroredSession> load() {
        return Optional.ofNullable(stored.get());
    }

    @Override
    public void clear() {
        stored.set(null);
    }
}

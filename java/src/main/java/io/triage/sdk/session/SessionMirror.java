package io.triage.sdk.session;

import java.io.IOException;
import java.util.Optional;

/**
 * Local key-value persistence mirroring the displayable part of the session.
 */
public interface SessionMirror {

    void save(MirroredSession session) throws IOException;

    Optional<MirroredSession> load() throws IOException;

    void clear() throws IOException;
}

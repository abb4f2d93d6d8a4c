package io.triage.sdk.auth;

import io.triage.sdk.TriageException;
import io.triage.sdk.session.InMemorySessionMirror;
import io.triage.sdk.session.MirroredSession;
import io.triage.sdk.session.SessionMirror;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-local holder of the single live {@link Credential}.
 *
 * <p>The store is either empty or holds a fully populated credential; every change swaps the whole value. Reads are
 * lock-free, so a request issued after a write observes that write. Each change is mirrored (without the token) into
 * the configured {@link SessionMirror}; a failing mirror is logged and never blocks the in-memory update.</p>
 *
 * <p>Writes are serialised: a change and its mirror write complete before {@link #clear()} can run, so a cleared
 * store is never followed by a late mirror write of the session it replaced.</p>
 */
public final class CredentialStore {

    private static final Logger LOGGER = Logger.getLogger(CredentialStore.class.getName());

    private final AtomicReference<Credential> current = new AtomicReference<>();
    private final SessionMirror mirror;
    private final ReentrantLock writeLock = new ReentrantLock();

    public CredentialStore() {
        this(new InMemorySessionMirror());
    }

    public CredentialStore(SessionMirror mirror) {
        this.mirror = Objects.requireNonNull(mirror, "mirror");
    }

    public Optional<Credential> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @return the current bearer token, or {@code null} when no session is established.
     */
    public String accessToken() {
        Credential credential = current.get();
        return credential == null ? null : credential.getAccessToken();
    }

    public boolean isAuthenticated() {
        return current.get() != null;
    }

    /**
     * Installs the credential issued by login or registration, replacing any previous one.
     */
    public void establish(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        writeLock.lock();
        try {
            current.set(credential);
            LOGGER.info(() -> "[triage-sdk] session established for user " + credential.getUser().id());
            mirror(credential);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Rotates the token of the live credential in place.
     *
     * @return {@code false} when there is no credential to update.
     */
    public boolean replaceAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token is required");
        }
        writeLock.lock();
        try {
            return updateIfPresent(c -> c.withAccessToken(token)) != null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces the project list, keeping the token and the active project.
     */
    public boolean replaceProjects(List<Project> projects) {
        writeLock.lock();
        try {
            Credential updated = updateIfPresent(c -> c.withProjects(projects));
            if (updated != null) {
                mirror(updated);
            }
            return updated != null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Swaps in the result of a project switch: token and active project are replaced in one step.
     *
     * @throws TriageException when the session was torn down while the switch was in flight.
     */
    public Credential switchProject(String token, Project project) throws TriageException {
        Objects.requireNonNull(project, "project");
        writeLock.lock();
        try {
            Credential next = updateIfPresent(c -> c.withSwitchedProject(token, project));
            if (next == null) {
                throw new TriageException("session ended while switching to project " + project.id());
            }
            LOGGER.info(() -> "[triage-sdk] active project switched to " + project.id());
            mirror(next);
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Empties the store and the session mirror. Waits for an in-flight change to finish its mirror write first.
     *
     * @return the credential that was live, if any.
     */
    public Optional<Credential> clear() {
        writeLock.lock();
        try {
            Credential previous = current.getAndSet(null);
            try {
                mirror.clear();
            } catch (IOException | RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[triage-sdk] unable to clear session mirror", ex);
            }
            return Optional.ofNullable(previous);
        } finally {
            writeLock.unlock();
        }
    }

    private Credential updateIfPresent(UnaryOperator<Credential> change) {
        return current.updateAndGet(c -> c == null ? null : change.apply(c));
    }

    private void mirror(Credential credential) {
        try {
            mirror.save(MirroredSession.of(credential));
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[triage-sdk] unable to mirror session state", ex);
        }
    }
}

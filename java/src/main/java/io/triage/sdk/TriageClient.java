package io.triage.sdk;

import io.triage.sdk.auth.AuthApi;
import io.triage.sdk.auth.Credential;
import io.triage.sdk.auth.CredentialAttacher;
import io.triage.sdk.auth.CredentialStore;
import io.triage.sdk.auth.Project;
import io.triage.sdk.auth.ProjectSwitcher;
import io.triage.sdk.auth.RegistrationRequest;
import io.triage.sdk.auth.SessionLogout;
import io.triage.sdk.auth.SessionRefresher;
import io.triage.sdk.gateway.ApiGateway;
import io.triage.sdk.gateway.ApiRequest;
import io.triage.sdk.gateway.ApiResponse;
import io.triage.sdk.gateway.FailureClassifier;
import io.triage.sdk.gateway.HttpTransport;
import io.triage.sdk.gateway.RefreshCoordinator;
import io.triage.sdk.session.MirroredSession;
import io.triage.sdk.session.SessionMirror;
import io.triage.sdk.session.SessionTeardown;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for talking to the Triage API gateway on behalf of a signed-in user. The client is thread-safe:
 * create one instance per session holder and route every API call through it.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Attaches the current bearer token to every request; the token is read when the request is sent.</li>
 *   <li>Recovers from an expired session: any number of requests failing concurrently with {@code 401} share a single
 *       call to the refresh endpoint and are replayed once it succeeds.</li>
 *   <li>Ends the session when the refresh fails: the gateway is asked to log out (best-effort), then credential,
 *       mirrored session data and cookies are cleared and the {@link io.triage.sdk.session.Navigator} is sent to the
 *       login path.</li>
 *   <li>Switches the active project, rotating the credential atomically.</li>
 * </ul>
 */
public final class TriageClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TriageClient.class.getName());

    private final Config config;
    private final CredentialStore store;
    private final RefreshCoordinator coordinator;
    private final ApiGateway gateway;
    private final AuthApi authApi;
    private final ProjectSwitcher projectSwitcher;
    private final MirroredSession restoredSession;

    /**
     * Constructs a new client using the supplied configuration.
     *
     * @param config caller-supplied configuration; every field is optional. Defaults are applied to a copy, so later
     *               changes to the builder do not influence this client.
     */
    public TriageClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();

        SessionMirror mirror = this.config.getSessionMirror();
        this.restoredSession = restore(mirror);
        this.store = new CredentialStore(mirror);

        CredentialAttacher attacher = new CredentialAttacher(store);
        HttpTransport transport = new HttpTransport(
            this.config.getHttpClient(),
            this.config.getBaseUrl(),
            this.config.getHttpTimeout(),
            attacher
        );
        FailureClassifier classifier = new FailureClassifier(this.config.getExemptPaths());

        SessionTeardown teardown = new SessionTeardown(
            store,
            this.config.getCookieManager() == null ? null : this.config.getCookieManager().getCookieStore(),
            this.config.getNavigator(),
            this.config.getLoginPath()
        );
        SessionLogout sessionLogout = new SessionLogout(transport, teardown);
        this.coordinator = new RefreshCoordinator(new SessionRefresher(transport, classifier, store), sessionLogout::logout);
        this.gateway = new ApiGateway(transport, classifier, coordinator);
        this.authApi = new AuthApi(gateway, store, sessionLogout);
        this.projectSwitcher = new ProjectSwitcher(gateway, store);
    }

    /**
     * Signs in with email and password.
     *
     * @throws TriageApiException with kind {@link io.triage.sdk.gateway.FailureKind#AUTH_ENDPOINT_FAILURE} when the
     *                            credentials are rejected.
     */
    public Credential login(String email, String password) throws TriageException {
        return authApi.login(email, password);
    }

    public Credential register(RegistrationRequest request) throws TriageException {
        return authApi.register(request);
    }

    /**
     * Signs out: the gateway is asked to drop its cookies (best-effort) and the local session is torn down.
     */
    public void logout() {
        authApi.logout();
    }

    /**
     * Makes {@code projectId} the active project.
     *
     * @throws TriageException when the project is not listed or not active, or the gateway rejects the switch. The
     *                         current credential is left unchanged in that case.
     */
    public Credential switchProject(String projectId) throws TriageException {
        return projectSwitcher.switchTo(projectId);
    }

    public List<Project> reloadProjects() throws TriageException {
        return authApi.reloadProjects();
    }

    public Optional<Credential> currentCredential() {
        return store.current();
    }

    public boolean isAuthenticated() {
        return store.isAuthenticated();
    }

    /**
     * Identity and projects mirrored by a previous run, for display until the user signs in again. Never carries a
     * token.
     */
    public Optional<MirroredSession> restoredSession() {
        return Optional.ofNullable(restoredSession);
    }

    public ApiResponse send(ApiRequest request) throws TriageException {
        return gateway.send(request);
    }

    public ApiResponse get(String path) throws TriageException {
        return gateway.send(ApiRequest.get(path));
    }

    public ApiResponse post(String path, Object body) throws TriageException {
        return gateway.send(ApiRequest.post(path, body));
    }

    public ApiResponse put(String path, Object body) throws TriageException {
        return gateway.send(ApiRequest.put(path, body));
    }

    public ApiResponse delete(String path) throws TriageException {
        return gateway.send(ApiRequest.delete(path));
    }

    public RefreshCoordinator refreshCoordinator() {
        return coordinator;
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Closes the client. A no-op: the {@link java.net.http.HttpClient} is owned by the configuration and the session
     * stays live until {@link #logout()} or a failed refresh ends it.
     */
    @Override
    public void close() {
        // httpClient is managed by Config; nothing to close.
    }

    private static MirroredSession restore(SessionMirror mirror) {
        try {
            return mirror.load().orElse(null);
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[triage-sdk] ignoring unreadable session mirror", ex);
            return null;
        }
    }
}

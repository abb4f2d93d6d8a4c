package io.triage.sdk;

import com.sun.net.httpserver.HttpExchange;
import io.triage.sdk.gateway.ApiResponse;
import io.triage.sdk.gateway.FailureKind;
import io.triage.sdk.gateway.RefreshState;
import io.triage.sdk.session.RecordingNavigator;
import io.triage.sdk.testing.FakeGatewayServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.triage.sdk.testing.FakeGatewayServer.bearer;
import static io.triage.sdk.testing.FakeGatewayServer.respond;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRecoveryTest {

    private static final String INCIDENTS = "/api/v1/incidents";
    private static final String REFRESH = "/api/v1/auth/refresh";
    private static final String LOGIN = "/api/v1/auth/login";
    private static final String LOGOUT = "/api/v1/auth/logout";

    private FakeGatewayServer server;
    private RecordingNavigator navigator;
    private TriageClient client;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeGatewayServer();
        navigator = new RecordingNavigator("/incidents");
        executor = Executors.newCachedThreadPool();
        server.on(LOGIN, exchange -> {
            Map<?, ?> body = FakeGatewayServer.readJson(exchange);
            if (!"secret".equals(body.get("password"))) {
                respond(exchange, 401, Map.of("detail", "Invalid credentials"));
                return;
            }
            respond(exchange, 200, Map.of(
                "access_token", "stale-token",
                "token_type", "bearer",
                "user", Map.of("id", "user-1", "email", "ops@example.com", "full_name", "Ops User",
                    "role", "admin", "tenant_id", "tenant-1", "tenant_name", "Acme"),
                "projects", List.of(Map.of("id", "proj-1", "name", "Core", "slug", "core",
                    "role", "owner", "is_active", true))
            ));
        });

        server.on(LOGOUT, exchange -> respond(exchange, 200, Map.of("message", "Logged out")));

        client = new TriageClient(Config.builder()
            .baseUrl(server.baseUrl())
            .httpTimeout(Duration.ofSeconds(5))
            .navigator(navigator)
            .build());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        server.close();
    }

    @Test
    void singleExpiredRequestIsRefreshedAndReplayed() throws Exception {
        server.on(INCIDENTS, this::incidentsAcceptingFreshToken);
        server.on(REFRESH, exchange -> respond(exchange, 200, Map.of("access_token", "fresh-token")));
        client.login("ops@example.com", "secret");

        ApiResponse response = client.get(INCIDENTS);

        assertEquals(200, response.getStatusCode());
        assertEquals("ok", response.json().path("status").asText());
        assertEquals(1, server.calls(REFRESH));
        assertEquals(2, server.calls(INCIDENTS));
        assertEquals(List.of(
            LOGIN + " -",
            INCIDENTS + " Bearer stale-token",
            REFRESH + " Bearer stale-token",
            INCIDENTS + " Bearer fresh-token"
        ), server.authorizations());
        assertEquals("fresh-token", client.currentCredential().orElseThrow().getAccessToken());
        assertEquals("proj-1", client.currentCredential().orElseThrow().getActiveProject().orElseThrow().id());
        assertTrue(navigator.history().isEmpty());
    }

    @Test
    void concurrentExpiredRequestsShareOneRefresh() throws Exception {
        int requests = 5;
        server.on(INCIDENTS, this::incidentsAcceptingFreshToken);
        server.on(REFRESH, exchange -> {
            awaitQueuedWaiters(requests - 1);
            respond(exchange, 200, Map.of("access_token", "fresh-token"));
        });
        client.login("ops@example.com", "secret");

        List<Future<ApiResponse>> futures = submitConcurrently(requests, () -> client.get(INCIDENTS));

        for (Future<ApiResponse> future : futures) {
            assertEquals(200, future.get(10, TimeUnit.SECONDS).getStatusCode());
        }
        assertEquals(1, server.calls(REFRESH));
        assertEquals(requests * 2, server.calls(INCIDENTS));
        assertEquals(1, client.refreshCoordinator().refreshesStarted());
        assertEquals(RefreshState.IDLE, client.refreshCoordinator().state());
    }

    @Test
    void replayOutcomesAreIndependent() throws Exception {
        AtomicInteger replays = new AtomicInteger();
        server.on(INCIDENTS, exchange -> {
            if ("fresh-token".equals(bearer(exchange)) && replays.incrementAndGet() == 1) {
                respond(exchange, 500, Map.of("detail", "shard unavailable"));
                return;
            }
            incidentsAcceptingFreshToken(exchange);
        });
        server.on(REFRESH, exchange -> {
            awaitQueuedWaiters(2);
            respond(exchange, 200, Map.of("access_token", "fresh-token"));
        });
        client.login("ops@example.com", "secret");

        List<Future<ApiResponse>> futures = submitConcurrently(3, () -> client.get(INCIDENTS));

        int succeeded = 0;
        int failed = 0;
        for (Future<ApiResponse> future : futures) {
            try {
                future.get(10, TimeUnit.SECONDS);
                succeeded++;
            } catch (ExecutionException ex) {
                TriageApiException error = assertInstanceOf(TriageApiException.class, ex.getCause());
                assertEquals(500, error.getStatusCode());
                assertEquals(FailureKind.OTHER_FAILURE, error.getKind());
                failed++;
            }
        }
        assertEquals(2, succeeded);
        assertEquals(1, failed);
        assertEquals(1, server.calls(REFRESH));
        assertTrue(client.isAuthenticated());
    }

    @Test
    void failedRefreshRejectsAllRequestsAndEndsSessionOnce() throws Exception {
        int requests = 3;
        server.on(INCIDENTS, this::incidentsAcceptingFreshToken);
        server.on(REFRESH, exchange -> {
            awaitQueuedWaiters(requests - 1);
            respond(exchange, 401, Map.of("detail", "Refresh token expired"));
        });
        client.login("ops@example.com", "secret");

        List<Future<ApiResponse>> futures = submitConcurrently(requests, () -> client.get(INCIDENTS));

        for (Future<ApiResponse> future : futures) {
            ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            RefreshFailedException failure = assertInstanceOf(RefreshFailedException.class, ex.getCause());
            assertEquals(FailureKind.REFRESH_FAILED, failure.getKind());
            TriageApiException cause = assertInstanceOf(TriageApiException.class, failure.getCause());
            assertEquals(FailureKind.AUTH_ENDPOINT_FAILURE, cause.getKind());
        }
        assertEquals(1, server.calls(REFRESH));
        assertEquals(requests, server.calls(INCIDENTS));
        assertEquals(1, server.calls(LOGOUT));
        assertTrue(server.authorizations().contains(LOGOUT + " Bearer stale-token"));
        assertEquals(List.of("/login"), navigator.history());
        assertFalse(client.isAuthenticated());
    }

    @Test
    void replayThatExpiresAgainIsNotRequeued() throws Exception {
        server.on(INCIDENTS, exchange -> respond(exchange, 401, Map.of("detail", "Token has been revoked")));
        server.on(REFRESH, exchange -> respond(exchange, 200, Map.of("access_token", "fresh-token")));
        client.login("ops@example.com", "secret");

        TriageApiException ex = assertThrows(TriageApiException.class, () -> client.get(INCIDENTS));

        assertEquals(FailureKind.RETRY_EXHAUSTED, ex.getKind());
        assertEquals(401, ex.getStatusCode());
        assertEquals("Token has been revoked", ex.getMessage());
        assertEquals(1, server.calls(REFRESH));
        assertEquals(2, server.calls(INCIDENTS));
        assertEquals(0, server.calls(LOGOUT));
        assertTrue(client.isAuthenticated());
        assertTrue(navigator.history().isEmpty());
    }

    @Test
    void rejectedLoginNeverTriggersRefresh() {
        server.on(REFRESH, exchange -> respond(exchange, 200, Map.of()));

        TriageApiException ex = assertThrows(TriageApiException.class, () -> client.login("ops@example.com", "wrong"));

        assertEquals(FailureKind.AUTH_ENDPOINT_FAILURE, ex.getKind());
        assertEquals(401, ex.getStatusCode());
        assertEquals("Invalid credentials", ex.getMessage());
        assertEquals(0, server.calls(REFRESH));
        assertFalse(client.isAuthenticated());
        assertTrue(navigator.history().isEmpty());
    }

    @Test
    void ordinaryFailuresPassThroughUntouched() throws Exception {
        server.on(INCIDENTS, exchange -> respond(exchange, 404, Map.of("detail", "Incident not found")));
        server.on(REFRESH, exchange -> respond(exchange, 200, Map.of()));
        client.login("ops@example.com", "secret");

        TriageApiException ex = assertThrows(TriageApiException.class, () -> client.get(INCIDENTS + "/missing"));

        assertEquals(FailureKind.OTHER_FAILURE, ex.getKind());
        assertEquals(404, ex.getStatusCode());
        assertEquals(1, server.calls(INCIDENTS));
        assertEquals(0, server.calls(REFRESH));
    }

    @Test
    void refreshWithoutTokenBodyKeepsCredentialAndReliesOnCookie() throws Exception {
        AtomicInteger incidentCalls = new AtomicInteger();
        server.on(INCIDENTS, exchange -> {
            if (incidentCalls.incrementAndGet() == 1) {
                respond(exchange, 401, Map.of("detail", "Token expired"));
            } else {
                respond(exchange, 200, Map.of("status", "ok"));
            }
        });
        server.on(REFRESH, exchange -> respond(exchange, 204, null));
        client.login("ops@example.com", "secret");

        ApiResponse response = client.get(INCIDENTS);

        assertEquals(200, response.getStatusCode());
        assertEquals("stale-token", client.currentCredential().orElseThrow().getAccessToken());
        assertEquals(1, server.calls(REFRESH));
    }

    @Test
    void requestsWithoutSessionAreSentWithoutAuthorization() throws Exception {
        server.on("/api/v1/health", exchange -> respond(exchange, 200, Map.of("status", "ok")));

        client.get("/api/v1/health");

        assertEquals(List.of("/api/v1/health -"), server.authorizations());
    }

    private void incidentsAcceptingFreshToken(HttpExchange exchange) throws IOException {
        if ("fresh-token".equals(bearer(exchange))) {
            respond(exchange, 200, Map.of("status", "ok"));
        } else {
            respond(exchange, 401, Map.of("detail", "Token expired"));
        }
    }

    private void awaitQueuedWaiters(int expected) {
        FakeGatewayServer.await(() -> client.refreshCoordinator().pendingWaiters() >= expected, Duration.ofSeconds(5));
    }

    private <T> List<Future<T>> submitConcurrently(int count, Callable<T> task) {
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(executor.submit(task));
        }
        return futures;
    }
}

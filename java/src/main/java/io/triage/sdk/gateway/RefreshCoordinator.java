package io.triage.sdk.gateway;

import io.triage.sdk.RefreshFailedException;
import io.triage.sdk.TriageException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-flight coordinator for session refreshes.
 *
 * <p>The first caller to arrive while {@link RefreshState#IDLE} becomes the driver: it flips the state to
 * {@link RefreshState#REFRESHING} and runs the one {@link RefreshOperation}. Callers arriving while a refresh is in
 * flight are queued as waiters and block until it settles. The check-and-set of the state and the queue append
 * happen under one lock, so two callers can never both become the driver.</p>
 *
 * <p>When the refresh settles the state returns to idle and the queue is drained in enqueue order: on success every
 * waiter is told to retry, on failure the session teardown runs once and every waiter, and the driver, fails with
 * {@link RefreshFailedException}.</p>
 */
public final class RefreshCoordinator {

    private static final Logger LOGGER = Logger.getLogger(RefreshCoordinator.class.getName());

    private final RefreshOperation operation;
    private final Runnable onRefreshFailure;

    private final ReentrantLock lock = new ReentrantLock();
    private RefreshState state = RefreshState.IDLE;
    private List<Waiter> waiters = new ArrayList<>();

    private final AtomicLong refreshesStarted = new AtomicLong();

    public RefreshCoordinator(RefreshOperation operation, Runnable onRefreshFailure) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.onRefreshFailure = Objects.requireNonNull(onRefreshFailure, "onRefreshFailure");
    }

    /**
     * Blocks until the session has been refreshed, either by running the refresh or by joining the one in flight.
     * Returning normally means the caller should replay its request.
     *
     * @throws RefreshFailedException when the refresh failed; the session is torn down.
     * @throws TriageException when the calling thread is interrupted while waiting.
     */
    public void awaitRefresh() throws TriageException {
        Waiter waiter = null;
        lock.lock();
        try {
            if (state == RefreshState.IDLE) {
                state = RefreshState.REFRESHING;
            } else {
                waiter = new Waiter();
                waiters.add(waiter);
            }
        } finally {
            lock.unlock();
        }

        if (waiter == null) {
            drive();
        } else {
            waiter.await();
        }
    }

    public RefreshState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of callers currently queued behind the in-flight refresh.
     */
    public int pendingWaiters() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of refresh operations started since construction.
     */
    public long refreshesStarted() {
        return refreshesStarted.get();
    }

    private void drive() throws RefreshFailedException {
        long attempt = refreshesStarted.incrementAndGet();
        LOGGER.info(() -> "[triage-sdk] session expired; starting refresh #" + attempt);

        Exception failure = null;
        try {
            operation.refresh();
        } catch (TriageException | RuntimeException ex) {
            failure = ex;
        } catch (Error err) {
            // queued callers must not block on a refresh that will never settle
            for (Waiter waiter : settle()) {
                waiter.fail(err);
            }
            throw err;
        }

        List<Waiter> drained = settle();

        if (failure == null) {
            LOGGER.info(() -> "[triage-sdk] refresh #" + attempt + " succeeded; replaying "
                + (drained.size() + 1) + " request(s)");
            for (Waiter waiter : drained) {
                waiter.retry();
            }
            return;
        }

        Exception cause = failure;
        LOGGER.log(Level.WARNING, cause, () -> "[triage-sdk] refresh #" + attempt + " failed; ending session and rejecting "
            + (drained.size() + 1) + " request(s)");
        try {
            onRefreshFailure.run();
        } finally {
            for (Waiter waiter : drained) {
                waiter.fail(cause);
            }
        }
        throw new RefreshFailedException(refreshFailedMessage(cause), cause);
    }

    private List<Waiter> settle() {
        lock.lock();
        try {
            List<Waiter> drained = waiters;
            waiters = new ArrayList<>();
            state = RefreshState.IDLE;
            return drained;
        } finally {
            lock.unlock();
        }
    }

    private static String refreshFailedMessage(Throwable cause) {
        String detail = cause == null ? null : cause.getMessage();
        return detail == null || detail.isBlank() ? "session refresh failed" : "session refresh failed: " + detail;
    }

    private static final class Waiter {

        private final CompletableFuture<Void> outcome = new CompletableFuture<>();

        void retry() {
            outcome.complete(null);
        }

        void fail(Throwable cause) {
            outcome.completeExceptionally(cause);
        }

        void await() throws TriageException {
            try {
                outcome.get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TriageException("waiting for session refresh interrupted", ex);
            } catch (ExecutionException ex) {
                throw new RefreshFailedException(refreshFailedMessage(ex.getCause()), ex.getCause());
            }
        }
    }
}

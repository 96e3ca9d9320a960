package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.SessionArtifact;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A login running in the background. Cancelling stops the attempt at its next step or wait
 * and guarantees that nothing is persisted.
 */
public class LoginHandle {
    private final String userId;
    private final CancellationToken cancellationToken;
    private final CompletableFuture<SessionArtifact> result;
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private volatile Future<?> task;

    LoginHandle(String userId, CancellationToken cancellationToken, CompletableFuture<SessionArtifact> result) {
        this.userId = userId;
        this.cancellationToken = cancellationToken;
        this.result = result;
    }

    void attach(Future<?> task) {
        this.task = task;
    }

    /**
     * Called by the worker before it starts; false if the login was cancelled while queued.
     */
    boolean begin() {
        return claimed.compareAndSet(false, true);
    }

    void complete(SessionArtifact artifact) {
        result.complete(artifact);
    }

    void fail(Throwable failure) {
        result.completeExceptionally(failure);
    }

    public String getUserId() {
        return userId;
    }

    public void cancel() {
        cancellationToken.cancel();
        Future<?> running = task;
        if (running != null) {
            running.cancel(true);
        }
        if (claimed.compareAndSet(false, true)) {
            // never started, so no worker will complete it
            result.completeExceptionally(AuthFlowException.cancelled());
        }
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Block until the attempt finishes.
     *
     * @throws AuthFlowException when the attempt failed or was cancelled
     */
    public SessionArtifact await() {
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw AuthFlowException.cancelled();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    /**
     * As {@link #await()}, giving up after {@code timeout}.
     *
     * @throws TimeoutException when the attempt is still running; it is not cancelled
     */
    public SessionArtifact await(long timeout, TimeUnit unit) throws TimeoutException {
        try {
            return result.get(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw AuthFlowException.cancelled();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    public CompletableFuture<SessionArtifact> toFuture() {
        return result;
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return AuthFlowException.networkError("Login failed: " + cause, cause);
    }
}

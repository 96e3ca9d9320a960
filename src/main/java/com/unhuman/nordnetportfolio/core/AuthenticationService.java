package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.Credentials;
import com.unhuman.nordnetportfolio.model.SessionArtifact;
import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs login attempts off the caller's thread. Attempts for the same user are strictly
 * serialized: a second attempt starts only once the first has reached a terminal state.
 * A successful, uncancelled attempt is saved to the {@link SessionStore}.
 */
public class AuthenticationService {
    private final ConfigManager configManager;
    private final HttpSessionFactory httpSessionFactory;
    private final SessionStore sessionStore;
    private final ConcurrentHashMap<String, ReentrantLock> attemptLocks = new ConcurrentHashMap<>();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactory() {
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "LoginWorker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    });

    public AuthenticationService(ConfigManager configManager, HttpSessionFactory httpSessionFactory,
                                 SessionStore sessionStore) {
        this.configManager = configManager;
        this.httpSessionFactory = httpSessionFactory;
        this.sessionStore = sessionStore;
    }

    /**
     * Start a login in the background.
     *
     * @param listener receives progress on the worker thread; may be null
     */
    public LoginHandle startLogin(Credentials credentials, AuthProgressListener listener) {
        AuthProgressListener progress = listener != null ? listener : AuthProgressListener.NONE;
        CancellationToken token = new CancellationToken();
        LoginHandle handle = new LoginHandle(credentials.getUserId(), token, new CompletableFuture<>());
        handle.attach(executor.submit(() -> runSerialized(credentials, token, progress, handle)));
        return handle;
    }

    /**
     * Log in and wait for the result on the calling thread.
     */
    public SessionArtifact login(Credentials credentials, AuthProgressListener listener) {
        return startLogin(credentials, listener).await();
    }

    private void runSerialized(Credentials credentials, CancellationToken token,
                               AuthProgressListener listener, LoginHandle handle) {
        if (!handle.begin()) {
            return;
        }
        String userId = credentials.getUserId();
        ReentrantLock lock = attemptLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        try {
            if (lock.isLocked()) {
                LogManager.getInstance().info(LogCategory.AUTHENTICATION,
                        "Waiting for the login already in progress for " + userId);
            }
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.fail(AuthFlowException.cancelled());
            return;
        }
        try {
            token.throwIfCancelled();
            SessionArtifact artifact = runAttempt(credentials, token, listener);
            token.throwIfCancelled();
            if (!sessionStore.save(userId, artifact)) {
                LogManager.getInstance().warn(LogCategory.SESSION,
                        "Session could not be stored; it will only last for this run");
            } else if (token.isCancelled()) {
                sessionStore.invalidate(userId);
                throw AuthFlowException.cancelled();
            }
            handle.complete(artifact);
        } catch (RuntimeException e) {
            if (!(e instanceof AuthFlowException)) {
                LogManager.getInstance().error(LogCategory.AUTHENTICATION, "Login failed: " + e.getMessage(), e);
            }
            handle.fail(e);
        } catch (Error e) {
            LogManager.getInstance().error(LogCategory.AUTHENTICATION, "Login worker failed: " + e, e);
            handle.fail(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * One attempt, on the worker thread, while holding the user's attempt lock.
     */
    protected SessionArtifact runAttempt(Credentials credentials, CancellationToken token,
                                         AuthProgressListener listener) {
        return new AuthFlowController(configManager, httpSessionFactory, token, listener).run(credentials);
    }

    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LogManager.getInstance().warn(LogCategory.AUTHENTICATION, "Login workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.Credentials;
import com.unhuman.nordnetportfolio.model.SessionArtifact;
import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a stored session can be reused or a new login is needed, and supplies
 * {@link NordnetClient} with re-authentication. How a login is carried out is left to the
 * caller, which usually runs it through {@link AuthenticationService} and renders its progress.
 */
public class SessionManager {
    private final ConfigManager configManager;
    private final SessionStore sessionStore;

    public SessionManager(ConfigManager configManager, SessionStore sessionStore) {
        this.configManager = configManager;
        this.sessionStore = sessionStore;
    }

    /**
     * The stored session if the broker still accepts it, otherwise null. A rejected session is
     * removed from the store.
     */
    public SessionArtifact restoreSession(String userId) {
        SessionArtifact stored = sessionStore.load(userId);
        if (stored == null) {
            return null;
        }
        if (sessionStore.probe(stored)) {
            LogManager.getInstance().info(LogCategory.SESSION, "Reusing stored session for " + userId);
            return stored;
        }
        LogManager.getInstance().info(LogCategory.SESSION, "Stored session for " + userId + " is no longer valid");
        sessionStore.invalidate(userId);
        return null;
    }

    /**
     * A working session: the stored one unless {@code forceLogin} is set or it was rejected,
     * otherwise a new one from {@code login}.
     */
    public SessionArtifact obtainSession(Credentials credentials, boolean forceLogin, Login login) {
        if (!forceLogin) {
            SessionArtifact restored = restoreSession(credentials.getUserId());
            if (restored != null) {
                return restored;
            }
        }
        return login.login(credentials);
    }

    /**
     * Re-authentication for {@code credentials}: drops the rejected session and logs in again.
     */
    public Reauthenticator reauthenticatorFor(Credentials credentials, Login login) {
        return rejected -> {
            LogManager.getInstance().info(LogCategory.SESSION,
                    "Session for " + credentials.getUserId() + " was rejected, logging in again");
            sessionStore.invalidate(credentials.getUserId());
            return login.login(credentials);
        };
    }

    public void logout(String userId) {
        sessionStore.invalidate(userId);
    }

    /**
     * Estimated seconds left of the session's lifetime, never negative. Display only; the
     * broker decides actual validity.
     */
    public long getSessionSecondsRemaining(SessionArtifact artifact) {
        return getSessionSecondsRemaining(artifact, Instant.now());
    }

    long getSessionSecondsRemaining(SessionArtifact artifact, Instant now) {
        Instant expiry = artifact.getIssuedAt().plus(Duration.ofMinutes(configManager.getSessionLifetimeMinutes()));
        return Math.max(0, Duration.between(now, expiry).getSeconds());
    }

    /** Produces a new session; failures are thrown as {@link AuthFlowException}. */
    @FunctionalInterface
    public interface Login {
        SessionArtifact login(Credentials credentials);
    }
}

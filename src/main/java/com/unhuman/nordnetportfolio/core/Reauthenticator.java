package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.SessionArtifact;

/**
 * Produces a fresh session when the broker rejects the current one.
 */
@FunctionalInterface
public interface Reauthenticator {

    /**
     * @param rejected the session the broker no longer accepts
     * @return a new, working session
     * @throws AuthFlowException when the login fails
     */
    SessionArtifact reauthenticate(SessionArtifact rejected);
}

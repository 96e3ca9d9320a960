package com.unhuman.nordnetportfolio.core;

/**
 * Receives progress from a login attempt. Called on the worker thread running the attempt;
 * implementations hand events over to whatever thread owns the user interface.
 */
public interface AuthProgressListener {

    /** Does nothing and answers no prompts. */
    AuthProgressListener NONE = new AuthProgressListener() {
        @Override
        public void onStateChanged(AuthFlowState state, String message) {
        }
    };

    void onStateChanged(AuthFlowState state, String message);

    /** Free-form status within a state, e.g. "Waiting for approval (40s left)". */
    default void onStatus(String message) {
    }

    /**
     * Ask the user for a value (the CPR number) and block until it is given.
     *
     * @return the answer, or null if the user gave none
     */
    default String requestInput(String prompt) throws InterruptedException {
        return null;
    }
}

package com.unhuman.nordnetportfolio.core;

/**
 * States of a single MitID login attempt. The last five are terminal; {@link #AUTHENTICATED}
 * is the only successful one.
 */
public enum AuthFlowState {
    INIT("Init", false),
    AUTHORIZATION_REQUESTED("AuthorizationRequested", false),
    PROVIDER_LOGIN_PAGE("ProviderLoginPage", false),
    CPR_VERIFICATION("CprVerification", false),
    APP_APPROVAL_PENDING("AppApprovalPending", false),
    CALLBACK_EXCHANGE("CallbackExchange", false),
    AUTHENTICATED("Authenticated", true),
    TIMED_OUT("TimedOut", true),
    REJECTED("Rejected", true),
    NETWORK_ERROR("NetworkError", true),
    PROTOCOL_MISMATCH("ProtocolMismatch", true);

    private final String displayName;
    private final boolean terminal;

    AuthFlowState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isFailure() {
        return terminal && this != AUTHENTICATED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

package com.unhuman.nordnetportfolio.core;

/**
 * Terminal failure of a login attempt. Carries the failure state the attempt ended in and a
 * short machine-readable reason.
 */
public class AuthFlowException extends RuntimeException {
    public static final String REASON_USER_CANCELLED = "user_cancelled";
    public static final String REASON_USER_DECLINED = "user_declined";
    public static final String REASON_CPR_REJECTED = "cpr_rejected";
    public static final String REASON_CPR_NOT_PROVIDED = "cpr_not_provided";
    public static final String REASON_IDENTITY_REJECTED = "identity_rejected";
    public static final String REASON_APPROVAL_TIMEOUT = "approval_timeout";
    public static final String REASON_APPROVAL_EXPIRED = "approval_expired";
    public static final String REASON_REDIRECT_CEILING = "redirect_ceiling";
    public static final String REASON_UNEXPECTED_PAGE = "unexpected_page";
    public static final String REASON_TRANSPORT = "transport";

    private final AuthFlowState outcome;
    private final String reason;

    public AuthFlowException(AuthFlowState outcome, String reason, String message, Throwable cause) {
        super(message, cause);
        if (outcome == null || !outcome.isFailure()) {
            throw new IllegalArgumentException("outcome must be a failure state: " + outcome);
        }
        this.outcome = outcome;
        this.reason = reason;
    }

    public AuthFlowException(AuthFlowState outcome, String reason, String message) {
        this(outcome, reason, message, null);
    }

    public static AuthFlowException networkError(String message, Throwable cause) {
        return new AuthFlowException(AuthFlowState.NETWORK_ERROR, REASON_TRANSPORT, message, cause);
    }

    public static AuthFlowException protocolMismatch(String reason, String message) {
        return new AuthFlowException(AuthFlowState.PROTOCOL_MISMATCH, reason, message);
    }

    public static AuthFlowException rejected(String reason, String message) {
        return new AuthFlowException(AuthFlowState.REJECTED, reason, message);
    }

    public static AuthFlowException timedOut(String reason, String message) {
        return new AuthFlowException(AuthFlowState.TIMED_OUT, reason, message);
    }

    public static AuthFlowException cancelled() {
        return rejected(REASON_USER_CANCELLED, "Login was cancelled by the user.");
    }

    public AuthFlowState getOutcome() {
        return outcome;
    }

    public String getReason() {
        return reason;
    }

    public boolean isCancelled() {
        return REASON_USER_CANCELLED.equals(reason);
    }

    /** Transient failures where starting a fresh attempt can help. */
    public boolean isRetryable() {
        return outcome == AuthFlowState.NETWORK_ERROR || outcome == AuthFlowState.TIMED_OUT;
    }

    /**
     * Text for the user, worded by what they can do about it.
     */
    public String getUserMessage() {
        switch (outcome) {
            case NETWORK_ERROR:
                return "Network problem while logging in. Please try again.";
            case TIMED_OUT:
                return "The MitID approval was not completed in time. Check your MitID app and try again.";
            case REJECTED:
                if (isCancelled()) {
                    return "Login cancelled.";
                }
                if (REASON_CPR_REJECTED.equals(reason) || REASON_CPR_NOT_PROVIDED.equals(reason)) {
                    return "CPR verification failed. Check the number and try again.";
                }
                return "The login was declined. Approve the request in your MitID app to log in.";
            case PROTOCOL_MISMATCH:
            default:
                return "Login failed: the login service responded unexpectedly.";
        }
    }

    @Override
    public String toString() {
        return "AuthFlowException: " + getMessage() + " (outcome: " + outcome + ", reason: " + reason + ")";
    }
}

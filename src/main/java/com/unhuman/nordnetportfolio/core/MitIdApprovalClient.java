package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;
import okhttp3.HttpUrl;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Collections;

/**
 * Talks to MitID for the app-approval part of a login: claims the identity, starts the app
 * request, polls it until the user answers and collects the authorization code.
 * Polling is bounded by the approval timeout and stops as soon as the attempt is cancelled.
 */
public class MitIdApprovalClient {
    private final BrowserEmulationClient browser;
    private final HttpUrl mitIdBaseUrl;
    private final long pollIntervalMillis;
    private final Duration approvalTimeout;
    private final long requestTimeoutMillis;
    private final CancellationToken cancellationToken;
    private final AuthProgressListener listener;

    public MitIdApprovalClient(BrowserEmulationClient browser, ConfigManager config,
                               CancellationToken cancellationToken, AuthProgressListener listener) {
        this.browser = browser;
        this.mitIdBaseUrl = HttpUrl.get(config.getMitIdBaseUrl() + "/");
        this.pollIntervalMillis = config.getPollIntervalMillis();
        this.approvalTimeout = Duration.ofSeconds(config.getApprovalTimeoutSeconds());
        this.requestTimeoutMillis = config.getRequestTimeoutSeconds() * 1000L;
        this.cancellationToken = cancellationToken;
        this.listener = listener;
    }

    /**
     * Pull the MitID authentication session id out of the provider's base64 hand-over payload.
     */
    public static String decodeAuthenticationSessionId(String aux) {
        try {
            String decoded = new String(Base64.getDecoder().decode(aux.trim()), StandardCharsets.UTF_8);
            String id = new JSONObject(decoded).getJSONObject("parameters").getString("authenticationSessionId");
            if (id.isEmpty()) {
                throw new JSONException("empty authenticationSessionId");
            }
            return id;
        } catch (IllegalArgumentException | JSONException e) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "Could not read the MitID hand-over payload: " + e.getMessage());
        }
    }

    /**
     * Claim {@code userId} for the session and send the approval request to the user's app.
     */
    public ApprovalRequest begin(String authenticationSessionId, String userId) {
        PageResult claim = browser.putJson(url("v1/authentication-sessions/" + authenticationSessionId),
                new JSONObject().put("identityClaim", userId));
        if (claim.getStatusCode() == 400 || claim.getStatusCode() == 404) {
            throw AuthFlowException.rejected(AuthFlowException.REASON_IDENTITY_REJECTED,
                    "MitID did not accept the user id (" + claim.getStatusCode() + ")");
        }
        requireSuccess(claim, "identity claim");

        PageResult init = browser.postJson(url("v2/authentication-sessions/" + authenticationSessionId + "/app/init"),
                new JSONObject(), Collections.emptyMap());
        requireSuccess(init, "app init");
        JSONObject json = parseObject(init, "app init");
        String pollUrl = json.optString("pollUrl", "");
        String ticket = json.optString("ticket", "");
        if (pollUrl.isEmpty() || ticket.isEmpty()) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "MitID app init response is missing pollUrl or ticket");
        }
        HttpUrl resolved = mitIdBaseUrl.resolve(pollUrl);
        if (resolved == null) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "MitID returned an invalid poll URL");
        }
        LogManager.getInstance().info(LogCategory.AUTHENTICATION, "MitID approval request sent to the app");
        return new ApprovalRequest(authenticationSessionId, resolved.toString(), ticket);
    }

    public ApprovalStatus poll(ApprovalRequest request, long timeoutMillis) {
        PageResult result = browser.postJson(request.getPollUrl(),
                new JSONObject().put("ticket", request.getTicket()), timeoutMillis);
        if (result.getStatusCode() >= 500) {
            throw AuthFlowException.networkError("MitID poll failed with status " + result.getStatusCode(), null);
        }
        requireSuccess(result, "approval poll");
        return ApprovalStatus.fromPollResponse(result.getBody());
    }

    /**
     * Poll until the user approves. Returns normally on approval only.
     *
     * @throws AuthFlowException TIMED_OUT when the approval window closes, REJECTED when the user
     *                           declines or cancels
     */
    public void awaitApproval(ApprovalRequest request) {
        long deadline = System.nanoTime() + approvalTimeout.toNanos();
        int polls = 0;
        while (true) {
            cancellationToken.throwIfCancelled();
            long remaining = millisUntil(deadline);
            if (remaining <= 0) {
                throw approvalTimedOut();
            }

            ApprovalStatus status;
            try {
                status = poll(request, Math.min(remaining, requestTimeoutMillis));
            } catch (AuthFlowException e) {
                if (e.getOutcome() == AuthFlowState.NETWORK_ERROR && !e.isCancelled() && millisUntil(deadline) <= 0) {
                    throw approvalTimedOut();
                }
                throw e;
            }
            polls++;

            switch (status) {
                case APPROVED:
                    LogManager.getInstance().info(LogCategory.AUTHENTICATION,
                            "MitID approval confirmed after " + polls + " poll(s)");
                    return;
                case REJECTED:
                    throw AuthFlowException.rejected(AuthFlowException.REASON_USER_DECLINED,
                            "The login request was declined in the MitID app");
                case EXPIRED:
                    throw AuthFlowException.timedOut(AuthFlowException.REASON_APPROVAL_EXPIRED,
                            "The MitID approval request expired");
                case PENDING:
                default:
                    break;
            }

            long wait = Math.min(pollIntervalMillis, millisUntil(deadline));
            if (wait <= 0) {
                throw approvalTimedOut();
            }
            listener.onStatus("Waiting for approval in the MitID app (" + (millisUntil(deadline) / 1000) + "s left)");
            try {
                if (cancellationToken.await(wait)) {
                    throw AuthFlowException.cancelled();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw AuthFlowException.cancelled();
            }
        }
    }

    /**
     * Close the approved MitID session and return the code the identity provider expects.
     */
    public String finalizeSession(ApprovalRequest request) {
        PageResult result = browser.putJson(
                url("v1/authentication-sessions/" + request.getAuthenticationSessionId() + "/finalization"),
                new JSONObject());
        requireSuccess(result, "finalization");
        String code = parseObject(result, "finalization").optString("authorizationCode", "");
        if (code.isEmpty()) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "MitID finalization did not return an authorization code");
        }
        return code;
    }

    private AuthFlowException approvalTimedOut() {
        return AuthFlowException.timedOut(AuthFlowException.REASON_APPROVAL_TIMEOUT,
                "No MitID approval within " + approvalTimeout.getSeconds() + " seconds");
    }

    private String url(String path) {
        return mitIdBaseUrl.resolve(path).toString();
    }

    private static long millisUntil(long deadlineNanos) {
        return (deadlineNanos - System.nanoTime()) / 1_000_000L;
    }

    private static void requireSuccess(PageResult result, String step) {
        if (!result.isSuccessful()) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "MitID " + step + " returned status " + result.getStatusCode());
        }
    }

    private static JSONObject parseObject(PageResult result, String step) {
        try {
            return new JSONObject(result.getBody());
        } catch (JSONException e) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "MitID " + step + " returned a non-JSON response");
        }
    }

    /** Handle for one outstanding app approval. */
    public static final class ApprovalRequest {
        private final String authenticationSessionId;
        private final String pollUrl;
        private final String ticket;

        public ApprovalRequest(String authenticationSessionId, String pollUrl, String ticket) {
            this.authenticationSessionId = authenticationSessionId;
            this.pollUrl = pollUrl;
            this.ticket = ticket;
        }

        public String getAuthenticationSessionId() { return authenticationSessionId; }
        public String getPollUrl() { return pollUrl; }
        public String getTicket() { return ticket; }
    }
}

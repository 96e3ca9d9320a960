package com.unhuman.nordnetportfolio.core;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Locale;

/**
 * Outcome of one poll of the MitID app approval.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    /**
     * Map a poll response body, e.g. {@code {"status":"OK","confirmation":true}}.
     *
     * @throws AuthFlowException with {@link AuthFlowState#PROTOCOL_MISMATCH} for anything unrecognised
     */
    public static ApprovalStatus fromPollResponse(String body) {
        JSONObject json;
        try {
            json = new JSONObject(body);
        } catch (JSONException | NullPointerException e) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "Approval poll returned a non-JSON response");
        }
        String status = json.optString("status", "").toLowerCase(Locale.ROOT);
        if (status.equals("timeout") || status.equals("pending") || status.startsWith("channel_")) {
            return PENDING;
        }
        if (status.equals("ok")) {
            return json.optBoolean("confirmation", false) ? APPROVED : REJECTED;
        }
        if (status.equals("cancelled") || status.equals("canceled") || status.equals("rejected")
                || status.equals("denied")) {
            return REJECTED;
        }
        if (status.equals("expired")) {
            return EXPIRED;
        }
        throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                "Unknown approval status: '" + json.optString("status", "") + "'");
    }
}

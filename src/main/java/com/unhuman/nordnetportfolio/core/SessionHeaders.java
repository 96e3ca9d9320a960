package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.SessionArtifact;
import okhttp3.Request;

/**
 * Attaches a stored session to an outgoing broker request.
 */
final class SessionHeaders {
    private SessionHeaders() {}

    static Request.Builder apply(Request.Builder builder, SessionArtifact artifact) {
        artifact.getHeaders().forEach(builder::header);
        String cookieHeader = artifact.toCookieHeader();
        if (cookieHeader != null) {
            builder.header("Cookie", cookieHeader);
        }
        return builder.header("accept", "application/json");
    }
}

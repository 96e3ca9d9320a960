package com.unhuman.nordnetportfolio.model;

import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reusable authenticated Nordnet session: the cookies and API headers (notably {@code ntag})
 * produced by a successful login, when it was issued and, when the broker reported one,
 * the broker-side user id.
 */
public final class SessionArtifact {
    private final Map<String, String> cookies;
    private final Map<String, String> headers;
    private final Instant issuedAt;
    private final String brokerUserId;

    public SessionArtifact(Map<String, String> cookies, Map<String, String> headers,
                           Instant issuedAt, String brokerUserId) {
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(
                cookies != null ? cookies : Collections.emptyMap()));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(
                headers != null ? headers : Collections.emptyMap()));
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.brokerUserId = (brokerUserId == null || brokerUserId.isEmpty()) ? null : brokerUserId;
    }

    public Map<String, String> getCookies() { return cookies; }
    public Map<String, String> getHeaders() { return headers; }
    public Instant getIssuedAt() { return issuedAt; }
    public String getBrokerUserId() { return brokerUserId; }

    /** True when there is something to authenticate with. */
    public boolean hasCredentials() {
        return !cookies.isEmpty() || headers.containsKey("Authorization");
    }

    /**
     * Value for a {@code Cookie} request header, or null when there are no cookies.
     */
    public String toCookieHeader() {
        if (cookies.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> cookie : cookies.entrySet()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(cookie.getKey()).append('=').append(cookie.getValue());
        }
        return sb.toString();
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("cookies", new JSONObject(cookies));
        json.put("headers", new JSONObject(headers));
        json.put("issuedAt", issuedAt.toString());
        if (brokerUserId != null) {
            json.put("brokerUserId", brokerUserId);
        }
        return json;
    }

    /**
     * Parse the form written by {@link #toJson()}.
     *
     * @throws IllegalArgumentException when required fields are missing or malformed
     */
    public static SessionArtifact fromJson(JSONObject json) {
        try {
            Map<String, String> cookies = toStringMap(json.getJSONObject("cookies"));
            Map<String, String> headers = toStringMap(json.optJSONObject("headers"));
            Instant issuedAt = Instant.parse(json.getString("issuedAt"));
            return new SessionArtifact(cookies, headers, issuedAt, json.optString("brokerUserId", null));
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed session data: " + e.getMessage(), e);
        }
    }

    private static Map<String, String> toStringMap(JSONObject obj) {
        Map<String, String> result = new LinkedHashMap<>();
        if (obj == null) {
            return result;
        }
        for (String key : obj.keySet()) {
            result.put(key, obj.getString(key));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionArtifact)) return false;
        SessionArtifact that = (SessionArtifact) o;
        return cookies.equals(that.cookies)
                && headers.equals(that.headers)
                && issuedAt.equals(that.issuedAt)
                && Objects.equals(brokerUserId, that.brokerUserId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cookies, headers, issuedAt, brokerUserId);
    }

    @Override
    public String toString() {
        return "SessionArtifact{cookies=" + cookies.keySet() + ", headers=" + headers.keySet()
                + ", issuedAt=" + issuedAt + ", brokerUserId=" + brokerUserId + "}";
    }
}

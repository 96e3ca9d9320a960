package com.unhuman.nordnetportfolio.model;

/**
 * What a single login attempt needs from the user: the MitID user identifier and, optionally,
 * the CPR number used when the provider asks for identity linking. Never persisted.
 */
public final class Credentials {
    private final String userId;
    private final String cprNumber;

    public Credentials(String userId, String cprNumber) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("userId must not be empty");
        }
        this.userId = userId.trim();
        this.cprNumber = (cprNumber == null || cprNumber.trim().isEmpty()) ? null : cprNumber.trim();
    }

    public Credentials(String userId) {
        this(userId, null);
    }

    public String getUserId() { return userId; }

    /** CPR number supplied up front, or null to prompt when the provider asks for it. */
    public String getCprNumber() { return cprNumber; }

    public boolean hasCprNumber() { return cprNumber != null; }

    @Override
    public String toString() {
        // the CPR number stays out of logs
        return "Credentials{userId=" + userId + ", cprNumber=" + (cprNumber != null ? "***" : "none") + "}";
    }
}

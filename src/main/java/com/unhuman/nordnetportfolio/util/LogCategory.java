package com.unhuman.nordnetportfolio.util;

/**
 * Log categories for filtering
 */
public enum LogCategory {
    AUTHENTICATION("Authentication"),
    SESSION("Session"),
    DATA_FETCH("Data Fetch"),
    GENERAL("General");

    private final String displayName;

    LogCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

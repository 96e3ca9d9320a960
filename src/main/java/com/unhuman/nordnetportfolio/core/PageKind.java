package com.unhuman.nordnetportfolio.core;

/**
 * What a response from the login chain turned out to be.
 */
public enum PageKind {
    /** 3xx with a Location to follow. */
    REDIRECT,
    /** HTML page whose only job is to post a form onward (SAML style hand-off). */
    AUTO_SUBMIT_FORM,
    /** Identity provider entry page pointing at the login page. */
    ENTRY_PAGE,
    /** Identity provider login page, carrying the MitID endpoints. */
    LOGIN_PAGE,
    /** CPR identity-linking form. */
    CPR_VERIFICATION,
    /** MitID hand-over payload; the app approval can be started. */
    APPROVAL_PENDING,
    /** Redirect to the broker's callback carrying the authorization code. */
    CALLBACK,
    UNKNOWN
}

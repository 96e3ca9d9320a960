package com.unhuman.nordnetportfolio.core;

import okhttp3.HttpUrl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Navigation state of one login attempt: where the emulated browser currently is, what was
 * last pulled out of a page, and how many redirects have been followed.
 * The redirect ceiling applies to each chain of automatic hops.
 */
public class RedirectContext {
    private final SessionCookieJar cookieJar;
    private final int maxRedirects;
    private final Map<String, String> extractedFields = new LinkedHashMap<>();
    private String currentUrl;
    private int chainHops;
    private int redirectCount;

    public RedirectContext(SessionCookieJar cookieJar, int maxRedirects) {
        if (maxRedirects <= 0) {
            throw new IllegalArgumentException("maxRedirects must be positive");
        }
        this.cookieJar = cookieJar;
        this.maxRedirects = maxRedirects;
    }

    public SessionCookieJar getCookieJar() { return cookieJar; }
    public int getMaxRedirects() { return maxRedirects; }
    public String getCurrentUrl() { return currentUrl; }
    public int getRedirectCount() { return redirectCount; }

    public Map<String, String> getExtractedFields() {
        return Collections.unmodifiableMap(extractedFields);
    }

    void navigatedTo(String url, Map<String, String> fields) {
        this.currentUrl = url;
        extractedFields.putAll(fields);
    }

    void beginChain() {
        chainHops = 0;
    }

    /**
     * Count one automatic hop.
     *
     * @throws AuthFlowException with {@link AuthFlowState#PROTOCOL_MISMATCH} past the ceiling
     */
    void recordRedirect(String target) {
        chainHops++;
        redirectCount++;
        if (chainHops > maxRedirects) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_REDIRECT_CEILING,
                    "Gave up after " + maxRedirects + " redirects (last target: " + loggable(target) + ")");
        }
    }

    /**
     * Scheme, host and path of {@code url}, for logs and messages. Query strings can carry
     * authorization codes and are never included.
     */
    static String loggable(String url) {
        if (url == null) {
            return "(none)";
        }
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed != null) {
            return parsed.scheme() + "://" + parsed.host() + parsed.encodedPath();
        }
        int end = url.length();
        for (char c : new char[] {'?', '#'}) {
            int index = url.indexOf(c);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        return url.substring(0, end);
    }
}

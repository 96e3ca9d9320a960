package com.unhuman.nordnetportfolio.core;

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory cookie jar for one login attempt. Cookies are shared across the broker, the
 * identity provider and MitID, scoped by the usual domain and path rules.
 */
public class SessionCookieJar implements CookieJar {
    private final List<Cookie> cookies = new ArrayList<>();

    @Override
    public synchronized void saveFromResponse(HttpUrl url, List<Cookie> received) {
        for (Cookie cookie : received) {
            store(cookie);
        }
    }

    @Override
    public synchronized List<Cookie> loadForRequest(HttpUrl url) {
        long now = System.currentTimeMillis();
        List<Cookie> matching = new ArrayList<>();
        for (Iterator<Cookie> it = cookies.iterator(); it.hasNext(); ) {
            Cookie cookie = it.next();
            if (cookie.expiresAt() < now) {
                it.remove();
            } else if (cookie.matches(url)) {
                matching.add(cookie);
            }
        }
        return matching;
    }

    /**
     * Set a client-side cookie for the host of {@code url}, as a browser script would.
     */
    public synchronized void set(HttpUrl url, String name, String value) {
        store(new Cookie.Builder()
                .name(name)
                .value(value)
                .hostOnlyDomain(url.host())
                .path("/")
                .build());
    }

    /**
     * Name to value of every cookie that would be sent to {@code url}.
     */
    public synchronized Map<String, String> cookiesFor(HttpUrl url) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Cookie cookie : loadForRequest(url)) {
            result.put(cookie.name(), cookie.value());
        }
        return result;
    }

    public synchronized int size() {
        return cookies.size();
    }

    public synchronized void clear() {
        cookies.clear();
    }

    private void store(Cookie cookie) {
        cookies.removeIf(existing -> existing.name().equals(cookie.name())
                && existing.domain().equals(cookie.domain())
                && existing.path().equals(cookie.path()));
        if (cookie.expiresAt() >= System.currentTimeMillis()) {
            cookies.add(cookie);
        }
    }
}

package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.util.HtmlUtil.HtmlForm;
import okhttp3.Headers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One classified response: its kind, the values pulled out of it, the URL it was served from,
 * and the cookies the jar holds for that URL afterwards.
 */
public class PageResult {
    private final PageKind kind;
    private final int statusCode;
    private final String url;
    private final Map<String, String> fields;
    private final HtmlForm form;
    private final Map<String, String> cookies;
    private final Headers headers;
    private final String body;

    public PageResult(PageKind kind, int statusCode, String url, Map<String, String> fields, HtmlForm form,
                      Map<String, String> cookies, Headers headers, String body) {
        this.kind = kind;
        this.statusCode = statusCode;
        this.url = url;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.form = form;
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
        this.headers = headers != null ? headers : Headers.of();
        this.body = body != null ? body : "";
    }

    public PageKind getKind() { return kind; }
    public int getStatusCode() { return statusCode; }
    public String getUrl() { return url; }
    public Map<String, String> getFields() { return fields; }
    public String getField(String name) { return fields.get(name); }
    /** The form to submit for {@link PageKind#AUTO_SUBMIT_FORM}, otherwise null. */
    public HtmlForm getForm() { return form; }
    public Map<String, String> getCookies() { return cookies; }
    public String getHeader(String name) { return headers.get(name); }
    public String getBody() { return body; }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "PageResult{" + kind + ", " + statusCode + ", " + url + ", fields=" + fields.keySet() + "}";
    }
}

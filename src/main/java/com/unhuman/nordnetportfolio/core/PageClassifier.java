package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.util.HtmlUtil;
import com.unhuman.nordnetportfolio.util.HtmlUtil.HtmlForm;
import okhttp3.HttpUrl;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides what a response in the login chain is, from status, location and markup only.
 * Has no side effects, so every rule can be exercised without a server.
 */
public class PageClassifier {
    public static final String FIELD_LOCATION = "location";
    public static final String FIELD_CODE = "code";
    public static final String FIELD_STATE = "state";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_INDEX_URL = "indexUrl";
    public static final String FIELD_BASE_URL = "baseUrl";
    public static final String FIELD_INIT_AUTH_PATH = "initAuthPath";
    public static final String FIELD_AUTH_CODE_PATH = "authCodePath";
    public static final String FIELD_FINALIZE_AUTH_PATH = "finalizeAuthPath";
    public static final String FIELD_VERIFY_PATH = "verifyPath";
    public static final String FIELD_FINALIZE_CPR_PATH = "finalizeCprPath";
    public static final String FIELD_AUX = "aux";

    private static final Pattern SCRIPTED_SUBMIT = Pattern.compile("\\.submit\\s*\\(\\s*\\)");
    private static final String[] SAML_FIELDS = {"SAMLResponse", "SAMLRequest", "RelayState"};

    private final HttpUrl callbackUrl;

    /**
     * @param callbackUri the broker redirect URI; a hop towards it ends the chain
     */
    public PageClassifier(String callbackUri) {
        this.callbackUrl = HttpUrl.get(callbackUri);
    }

    public Classification classify(int statusCode, HttpUrl url, String location, String contentType, String body) {
        Map<String, String> fields = new LinkedHashMap<>();

        if (statusCode >= 300 && statusCode < 400) {
            HttpUrl target = location != null ? url.resolve(location) : null;
            if (target == null) {
                return new Classification(PageKind.UNKNOWN, fields, null);
            }
            if (isCallback(target)) {
                return callback(target, fields);
            }
            fields.put(FIELD_LOCATION, target.toString());
            return new Classification(PageKind.REDIRECT, fields, null);
        }

        if (isCallback(url)) {
            return callback(url, fields);
        }

        String text = body != null ? body : "";
        if (looksLikeJson(contentType, text)) {
            return classifyJson(text, fields);
        }

        String cprTag = HtmlUtil.findElementStartTag(text, "main", "cpr-form");
        if (cprTag != null) {
            putIfPresent(fields, FIELD_BASE_URL, HtmlUtil.findAttribute(cprTag, "data-base-url"));
            putIfPresent(fields, FIELD_VERIFY_PATH, HtmlUtil.findAttribute(cprTag, "data-verify-path"));
            putIfPresent(fields, FIELD_FINALIZE_CPR_PATH, HtmlUtil.findAttribute(cprTag, "data-finalize-cpr-path"));
            return new Classification(PageKind.CPR_VERIFICATION, fields, null);
        }
        if (url.encodedPath().contains("/cpr")) {
            // form missing; the caller reports the mismatch
            return new Classification(PageKind.CPR_VERIFICATION, fields, null);
        }

        String indexUrl = HtmlUtil.findAttribute(text, "data-index-url");
        if (indexUrl != null) {
            HttpUrl resolved = url.resolve(indexUrl);
            fields.put(FIELD_INDEX_URL, resolved != null ? resolved.toString() : indexUrl);
            return new Classification(PageKind.ENTRY_PAGE, fields, null);
        }

        String baseUrl = HtmlUtil.findAttribute(text, "data-base-url");
        String initAuthPath = HtmlUtil.findAttribute(text, "data-init-auth-path");
        if (baseUrl != null && initAuthPath != null) {
            fields.put(FIELD_BASE_URL, baseUrl);
            fields.put(FIELD_INIT_AUTH_PATH, initAuthPath);
            putIfPresent(fields, FIELD_AUTH_CODE_PATH, HtmlUtil.findAttribute(text, "data-auth-code-path"));
            putIfPresent(fields, FIELD_FINALIZE_AUTH_PATH, HtmlUtil.findAttribute(text, "data-finalize-auth-path"));
            return new Classification(PageKind.LOGIN_PAGE, fields, null);
        }

        if (statusCode == 200) {
            HtmlForm form = HtmlUtil.findFirstForm(text);
            if (form != null && form.getAction() != null && !form.getAction().isEmpty() && isAutoSubmit(text, form)) {
                HttpUrl action = url.resolve(form.getAction());
                if (action != null) {
                    HtmlForm resolved = new HtmlForm(action.toString(), form.getMethod(), form.getFields());
                    fields.putAll(form.getFields());
                    return new Classification(PageKind.AUTO_SUBMIT_FORM, fields, resolved);
                }
            }
        }

        return new Classification(PageKind.UNKNOWN, fields, null);
    }

    /**
     * A form is followed only when the page submits it on its own: a scripted submit, a SAML
     * hand-off, or nothing but hidden inputs. Forms asking for user input are not.
     */
    static boolean isAutoSubmit(String html, HtmlForm form) {
        if (form.isInteractive()) {
            return false;
        }
        if (SCRIPTED_SUBMIT.matcher(html).find()) {
            return true;
        }
        for (String field : SAML_FIELDS) {
            if (form.getFields().containsKey(field)) {
                return true;
            }
        }
        return !form.getFields().isEmpty();
    }

    boolean isCallback(HttpUrl url) {
        return url.scheme().equals(callbackUrl.scheme())
                && url.host().equalsIgnoreCase(callbackUrl.host())
                && url.port() == callbackUrl.port()
                && url.encodedPath().equals(callbackUrl.encodedPath())
                && (url.queryParameter(FIELD_CODE) != null || url.queryParameter(FIELD_ERROR) != null);
    }

    private static Classification callback(HttpUrl target, Map<String, String> fields) {
        putIfPresent(fields, FIELD_CODE, target.queryParameter(FIELD_CODE));
        putIfPresent(fields, FIELD_STATE, target.queryParameter(FIELD_STATE));
        putIfPresent(fields, FIELD_ERROR, target.queryParameter(FIELD_ERROR));
        return new Classification(PageKind.CALLBACK, fields, null);
    }

    private static Classification classifyJson(String text, Map<String, String> fields) {
        try {
            JSONObject json = new JSONObject(text);
            String aux = json.optString(FIELD_AUX, null);
            if (aux != null && !aux.isEmpty()) {
                fields.put(FIELD_AUX, aux);
                return new Classification(PageKind.APPROVAL_PENDING, fields, null);
            }
        } catch (JSONException e) {
            // not an object; nothing to extract
        }
        return new Classification(PageKind.UNKNOWN, fields, null);
    }

    private static boolean looksLikeJson(String contentType, String body) {
        if (contentType != null && contentType.toLowerCase().contains("json")) {
            return true;
        }
        String trimmed = body.trim();
        return trimmed.startsWith("{") && trimmed.endsWith("}");
    }

    private static void putIfPresent(Map<String, String> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }

    /** Kind plus extracted fields; the form is set only for auto-submit pages. */
    public static final class Classification {
        private final PageKind kind;
        private final Map<String, String> fields;
        private final HtmlForm form;

        Classification(PageKind kind, Map<String, String> fields, HtmlForm form) {
            this.kind = kind;
            this.fields = fields;
            this.form = form;
        }

        public PageKind getKind() { return kind; }
        public Map<String, String> getFields() { return fields; }
        public HtmlForm getForm() { return form; }
    }
}

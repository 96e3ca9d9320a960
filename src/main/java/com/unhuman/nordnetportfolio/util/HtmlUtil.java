package com.unhuman.nordnetportfolio.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for HTML-related operations.
 * The identity provider's pages are read without a rendering engine, so markers and hidden
 * form fields are pulled out of the raw markup with patterns.
 */
public class HtmlUtil {

    private static final Pattern FORM_PATTERN = Pattern.compile(
            "<form\\b([^>]*)>(.*?)</form>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern INPUT_PATTERN = Pattern.compile(
            "<input\\b([^>]*)/?>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Set<String> NON_INTERACTIVE_TYPES = Set.of("hidden", "submit", "button", "image", "reset");

    private HtmlUtil() {}

    /**
     * Escape a string for safe inclusion in HTML content.
     */
    public static String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                   .replace("<", "&lt;")
                   .replace(">", "&gt;")
                   .replace("\"", "&quot;")
                   .replace("'", "&#39;");
    }

    /**
     * Reverse of {@link #escapeHtml(String)} for the entities that show up in attribute values.
     */
    public static String unescapeHtml(String text) {
        if (text == null) return null;
        return text.replace("&quot;", "\"")
                   .replace("&#39;", "'")
                   .replace("&#x27;", "'")
                   .replace("&#x2F;", "/")
                   .replace("&#47;", "/")
                   .replace("&lt;", "<")
                   .replace("&gt;", ">")
                   .replace("&amp;", "&");
    }

    /**
     * Value of the first occurrence of {@code attribute} anywhere in the markup, or null.
     * Matches both quote styles and is case-insensitive on the attribute name.
     */
    public static String findAttribute(String html, String attribute) {
        if (html == null || attribute == null) {
            return null;
        }
        Matcher m = attributePattern(attribute).matcher(html);
        return m.find() ? unescapeHtml(m.group(2)) : null;
    }

    /**
     * Value of {@code attribute} on the first element with the given id, or null.
     */
    public static String findAttributeOnElement(String html, String tag, String id, String attribute) {
        String element = findElementStartTag(html, tag, id);
        return element == null ? null : findAttribute(element, attribute);
    }

    /**
     * The start tag ({@code <main ...>}) of the first {@code tag} element with {@code id}, or null.
     */
    public static String findElementStartTag(String html, String tag, String id) {
        if (html == null) {
            return null;
        }
        Pattern p = Pattern.compile("<" + Pattern.quote(tag) + "\\b[^>]*\\bid\\s*=\\s*([\"'])"
                + Pattern.quote(id) + "\\1[^>]*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        Matcher m = p.matcher(html);
        return m.find() ? m.group() : null;
    }

    /**
     * The first form in the markup, or null when there is none.
     */
    public static HtmlForm findFirstForm(String html) {
        if (html == null) {
            return null;
        }
        Matcher formMatcher = FORM_PATTERN.matcher(html);
        if (!formMatcher.find()) {
            return null;
        }
        String formAttributes = formMatcher.group(1);
        String action = findAttribute(formAttributes, "action");
        String method = findAttribute(formAttributes, "method");

        Map<String, String> fields = new LinkedHashMap<>();
        boolean interactive = false;
        Matcher inputMatcher = INPUT_PATTERN.matcher(formMatcher.group(2));
        while (inputMatcher.find()) {
            String inputAttributes = inputMatcher.group(1);
            String type = findAttribute(inputAttributes, "type");
            if (type == null || !NON_INTERACTIVE_TYPES.contains(type.toLowerCase())) {
                interactive = true;
            }
            String name = findAttribute(inputAttributes, "name");
            if (name != null && !name.isEmpty()) {
                String value = findAttribute(inputAttributes, "value");
                fields.put(name, value != null ? value : "");
            }
        }
        return new HtmlForm(action, method == null ? "GET" : method.toUpperCase(), fields, interactive);
    }

    private static Pattern attributePattern(String attribute) {
        return Pattern.compile("(?<![\\w-])" + Pattern.quote(attribute) + "\\s*=\\s*([\"'])(.*?)\\1",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    /**
     * A form found in markup: its action, upper-cased method and named input values.
     */
    public static class HtmlForm {
        private final String action;
        private final String method;
        private final Map<String, String> fields;
        private final boolean interactive;

        public HtmlForm(String action, String method, Map<String, String> fields) {
            this(action, method, fields, false);
        }

        public HtmlForm(String action, String method, Map<String, String> fields, boolean interactive) {
            this.action = action;
            this.method = method;
            this.fields = fields;
            this.interactive = interactive;
        }

        public String getAction() { return action; }
        public String getMethod() { return method; }
        public Map<String, String> getFields() { return fields; }
        public boolean isPost() { return "POST".equals(method); }

        /** True when the form has an input a user would fill in, such as a text or password field. */
        public boolean isInteractive() { return interactive; }
    }
}

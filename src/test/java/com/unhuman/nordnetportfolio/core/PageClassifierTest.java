package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.core.PageClassifier.Classification;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;

import static org.junit.jupiter.api.Assertions.*;

class PageClassifierTest {

    private static final String CALLBACK = "https://broker.example/login";
    private final PageClassifier classifier = new PageClassifier(CALLBACK);
    private final HttpUrl idp = HttpUrl.get("https://idp.example/auth/start");

    private Classification html(String body) {
        return classifier.classify(200, idp, null, "text/html; charset=utf-8", body);
    }

    @Nested
    @DisplayName("redirects")
    class Redirects {

        @Test
        @DisplayName("relative location is resolved against the current URL")
        void relative() {
            Classification c = classifier.classify(302, idp, "../next?x=1", null, "");
            assertEquals(PageKind.REDIRECT, c.getKind());
            assertEquals("https://idp.example/next?x=1", c.getFields().get(PageClassifier.FIELD_LOCATION));
        }

        @Test
        @DisplayName("redirect to the callback URI is the callback, with code and state")
        void towardsCallback() {
            Classification c = classifier.classify(303, idp, CALLBACK + "?code=abc&state=s1", null, "");
            assertEquals(PageKind.CALLBACK, c.getKind());
            assertEquals("abc", c.getFields().get(PageClassifier.FIELD_CODE));
            assertEquals("s1", c.getFields().get(PageClassifier.FIELD_STATE));
        }

        @Test
        @DisplayName("callback carrying an error is still the callback")
        void callbackError() {
            Classification c = classifier.classify(302, idp, CALLBACK + "?error=access_denied", null, "");
            assertEquals(PageKind.CALLBACK, c.getKind());
            assertEquals("access_denied", c.getFields().get(PageClassifier.FIELD_ERROR));
        }

        @Test
        @DisplayName("callback path without code is an ordinary redirect")
        void callbackPathWithoutCode() {
            Classification c = classifier.classify(302, idp, CALLBACK, null, "");
            assertEquals(PageKind.REDIRECT, c.getKind());
        }

        @Test
        @DisplayName("redirect without location is unknown")
        void missingLocation() {
            assertEquals(PageKind.UNKNOWN, classifier.classify(302, idp, null, null, "").getKind());
        }
    }

    @Nested
    @DisplayName("provider pages")
    class ProviderPages {

        @Test
        @DisplayName("entry page exposes the resolved index URL")
        void entryPage() {
            Classification c = html("<div id=\"app\" data-index-url=\"/idp/index?s=1\"></div>");
            assertEquals(PageKind.ENTRY_PAGE, c.getKind());
            assertEquals("https://idp.example/idp/index?s=1", c.getFields().get(PageClassifier.FIELD_INDEX_URL));
        }

        @Test
        @DisplayName("login page exposes base URL and paths")
        void loginPage() {
            Classification c = html("<main data-base-url=\"https://idp.example/mitid\" "
                    + "data-init-auth-path=\"/init-auth\" data-auth-code-path=\"/auth-code\" "
                    + "data-finalize-auth-path=\"/finalize\"></main>");
            assertEquals(PageKind.LOGIN_PAGE, c.getKind());
            assertEquals("https://idp.example/mitid", c.getFields().get(PageClassifier.FIELD_BASE_URL));
            assertEquals("/init-auth", c.getFields().get(PageClassifier.FIELD_INIT_AUTH_PATH));
            assertEquals("/auth-code", c.getFields().get(PageClassifier.FIELD_AUTH_CODE_PATH));
            assertEquals("/finalize", c.getFields().get(PageClassifier.FIELD_FINALIZE_AUTH_PATH));
        }

        @Test
        @DisplayName("CPR form takes precedence over other markers")
        void cprForm() {
            Classification c = html("<main id=\"cpr-form\" data-base-url=\"https://idp.example/cpr\" "
                    + "data-verify-path=\"/verify\" data-finalize-cpr-path=\"/finalize\" "
                    + "data-init-auth-path=\"/init\"></main>");
            assertEquals(PageKind.CPR_VERIFICATION, c.getKind());
            assertEquals("/verify", c.getFields().get(PageClassifier.FIELD_VERIFY_PATH));
            assertEquals("/finalize", c.getFields().get(PageClassifier.FIELD_FINALIZE_CPR_PATH));
        }

        @Test
        @DisplayName("a /cpr page without the form is CPR verification without fields")
        void cprPathOnly() {
            Classification c = classifier.classify(200, HttpUrl.get("https://idp.example/idp/cpr"),
                    null, "text/html", "<p>Enter CPR</p>");
            assertEquals(PageKind.CPR_VERIFICATION, c.getKind());
            assertTrue(c.getFields().isEmpty());
        }

        @Test
        @DisplayName("self-submitting form is an auto-submit page with a resolved action")
        void autoSubmit() {
            Classification c = html("<form method=\"post\" action=\"/acs\">"
                    + "<input type=\"hidden\" name=\"SAMLResponse\" value=\"xyz\"></form>");
            assertEquals(PageKind.AUTO_SUBMIT_FORM, c.getKind());
            assertEquals("https://idp.example/acs", c.getForm().getAction());
            assertTrue(c.getForm().isPost());
            assertEquals("xyz", c.getFields().get("SAMLResponse"));
        }

        @Test
        @DisplayName("hidden-only form is submitted")
        void hiddenOnly() {
            Classification c = html("<form method=\"post\" action=\"/continue\">"
                    + "<input type=\"hidden\" name=\"token\" value=\"t\"></form>");
            assertEquals(PageKind.AUTO_SUBMIT_FORM, c.getKind());
        }

        @Test
        @DisplayName("form asking for user input is unknown, not submitted")
        void interactiveForm() {
            Classification c = html("<form method=\"post\" action=\"/login\">"
                    + "<input type=\"text\" name=\"username\"><input type=\"password\" name=\"password\"></form>");
            assertEquals(PageKind.UNKNOWN, c.getKind());
            assertNull(c.getForm());
        }

        @Test
        @DisplayName("empty form without a scripted submit is unknown")
        void emptyForm() {
            assertEquals(PageKind.UNKNOWN, html("<form action=\"/retry\"><button>Try again</button></form>").getKind());
            assertEquals(PageKind.AUTO_SUBMIT_FORM,
                    html("<body onload=\"document.forms[0].submit()\"><form action=\"/next\"></form></body>").getKind());
        }

        @Test
        @DisplayName("form on an error status is not submitted")
        void formOnError() {
            Classification c = classifier.classify(500, idp, null, "text/html", "<form action=\"/x\"></form>");
            assertEquals(PageKind.UNKNOWN, c.getKind());
        }

        @Test
        @DisplayName("anything else is unknown")
        void unknown() {
            assertEquals(PageKind.UNKNOWN, html("<h1>Maintenance</h1>").getKind());
        }
    }

    @Nested
    @DisplayName("JSON responses")
    class Json {

        @Test
        @DisplayName("aux payload means approval is pending")
        void aux() {
            Classification c = classifier.classify(200, idp, null, "application/json", "{\"aux\":\"e30=\"}");
            assertEquals(PageKind.APPROVAL_PENDING, c.getKind());
            assertEquals("e30=", c.getFields().get(PageClassifier.FIELD_AUX));
        }

        @Test
        @DisplayName("JSON without aux is unknown")
        void noAux() {
            assertEquals(PageKind.UNKNOWN,
                    classifier.classify(200, idp, null, null, "{\"error\":\"x\"}").getKind());
        }

        @Test
        @DisplayName("loading the callback URL itself is the callback")
        void callbackUrl() {
            Classification c = classifier.classify(200, HttpUrl.get(CALLBACK + "?code=c1"), null, "text/html", "");
            assertEquals(PageKind.CALLBACK, c.getKind());
            assertEquals("c1", c.getFields().get(PageClassifier.FIELD_CODE));
        }
    }
}

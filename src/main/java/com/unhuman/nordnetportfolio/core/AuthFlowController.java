package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.Credentials;
import com.unhuman.nordnetportfolio.model.SessionArtifact;
import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;
import okhttp3.HttpUrl;
import okhttp3.MultipartBody;
import okhttp3.RequestBody;
import org.json.JSONException;
import org.json.JSONObject;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.unhuman.nordnetportfolio.core.BrowserEmulationClient.stopAt;

/**
 * Runs one MitID login attempt from the broker's login page to an authenticated brokerage
 * session. A controller is used for exactly one attempt; its cookie jar and navigation state
 * die with it.
 * <p>
 * State sequence: INIT, AUTHORIZATION_REQUESTED, PROVIDER_LOGIN_PAGE, optionally
 * CPR_VERIFICATION, APP_APPROVAL_PENDING, CALLBACK_EXCHANGE, AUTHENTICATED. CPR linking is also
 * handled when the provider asks for it only after the app approval. Any failure ends in one of
 * the failure states, reported to the listener and thrown as {@link AuthFlowException}.
 */
public class AuthFlowController {
    static final String CLIENT_ID = "NEXT";
    static final String NO_NTAG = "NO_NTAG_RECEIVED_YET";
    static final String SIGNICAT_START_PATH = "/authentication/v2/methods/signicat/start";
    static final String SESSIONS_PATH = "nnxapi/authentication/v2/sessions";
    static final String NNX_LOGIN_PATH = "api/2/authentication/nnx-session/login";

    private final ConfigManager configManager;
    private final HttpSessionFactory httpSessionFactory;
    private final CancellationToken cancellationToken;
    private final AuthProgressListener listener;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final List<AuthFlowState> history = Collections.synchronizedList(new ArrayList<>());
    private volatile AuthFlowState state;

    private SessionCookieJar cookieJar;
    private BrowserEmulationClient browser;
    private HttpUrl brokerUrl;

    public AuthFlowController(ConfigManager configManager, HttpSessionFactory httpSessionFactory,
                              CancellationToken cancellationToken, AuthProgressListener listener) {
        this.configManager = configManager;
        this.httpSessionFactory = httpSessionFactory;
        this.cancellationToken = cancellationToken;
        this.listener = listener != null ? listener : AuthProgressListener.NONE;
    }

    public AuthFlowState getState() {
        return state;
    }

    /** States entered so far, in order. */
    public List<AuthFlowState> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    /**
     * Run the attempt to completion.
     *
     * @return the new session; never null
     * @throws AuthFlowException     when the attempt ends in a failure state
     * @throws IllegalStateException when the configuration is unusable or the controller was already run
     */
    public SessionArtifact run(Credentials credentials) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("An AuthFlowController runs a single login attempt");
        }
        configManager.validate();
        transition(AuthFlowState.INIT, "Preparing MitID login for " + credentials.getUserId());

        try {
            cookieJar = new SessionCookieJar();
            RedirectContext context = new RedirectContext(cookieJar, configManager.getMaxRedirects());
            browser = new BrowserEmulationClient(httpSessionFactory.newSession(cookieJar), context,
                    new PageClassifier(configManager.getBrokerRedirectUri()), cancellationToken);
            brokerUrl = HttpUrl.get(configManager.getBrokerBaseUrl() + "/");

            String authorizeUrl = requestAuthorization();
            PageResult loginPage = openProviderLogin(authorizeUrl, credentials);
            PageResult afterApproval = approveInApp(loginPage, credentials);

            PageResult callback = browser.follow(afterApproval,
                    stopAt(PageKind.CALLBACK, PageKind.CPR_VERIFICATION));
            if (callback.getKind() == PageKind.CPR_VERIFICATION) {
                callback = browser.follow(verifyIdentity(callback, credentials), stopAt(PageKind.CALLBACK));
            }
            if (callback.getKind() != PageKind.CALLBACK) {
                throw unexpected(callback, "the broker callback");
            }

            SessionArtifact artifact = exchangeCallback(callback);
            transition(AuthFlowState.AUTHENTICATED, "Logged in to Nordnet");
            return artifact;
        } catch (AuthFlowException e) {
            LogManager.getInstance().warn(LogCategory.AUTHENTICATION,
                    "Login attempt ended in " + e.getOutcome() + " (" + e.getReason() + "): " + e.getMessage());
            transition(e.getOutcome(), e.getUserMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            // malformed URL or markup handed to us by a page
            AuthFlowException mismatch = AuthFlowException.protocolMismatch(
                    AuthFlowException.REASON_UNEXPECTED_PAGE, "Malformed login page: " + e.getMessage());
            LogManager.getInstance().error(LogCategory.AUTHENTICATION, mismatch.getMessage(), e);
            transition(mismatch.getOutcome(), mismatch.getUserMessage());
            throw mismatch;
        }
    }

    /**
     * Pre-visit the broker, set the cookies its scripts would set, and ask the broker API for
     * the identity provider's authorize URL.
     */
    private String requestAuthorization() {
        browser.get(brokerUrl.resolve("logind").toString());
        cookieJar.set(brokerUrl, "consent_cookie", "analytics,functional,marketing,necessary");
        cookieJar.set(brokerUrl, "lang", "da");
        cookieJar.set(brokerUrl, "_dcid", "dcid.1." + System.currentTimeMillis() + "." + new SecureRandom().nextInt(1_000_000_000));

        String oidcState = "NEXT_OIDC_STATE_" + UUID.randomUUID();
        String redirectUri = configManager.getBrokerRedirectUri();
        JSONObject startBody = new JSONObject()
                .put("redirectUri", redirectUri)
                .put("state", oidcState)
                .put("idp", "MITID");

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("accept", "*/*");
        headers.put("x-locale", "da-DK");
        headers.put("origin", configManager.getBrokerBaseUrl());
        headers.put("referer", brokerUrl.toString());
        PageResult start = browser.postJson(configManager.getApiBaseUrl() + SIGNICAT_START_PATH, startBody, headers);

        String authorizeUrl = start.getStatusCode() == 200 ? readRequestUri(start.getBody()) : null;
        if (authorizeUrl == null) {
            LogManager.getInstance().warn(LogCategory.AUTHENTICATION,
                    "Authorization start failed (status " + start.getStatusCode() + "), using the fallback authorize URL");
            HttpUrl fallback = HttpUrl.parse(configManager.getFallbackAuthorizeUrl());
            if (fallback == null) {
                throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                        "Authorization start failed and the fallback authorize URL is invalid");
            }
            authorizeUrl = fallback.newBuilder()
                    .setQueryParameter("redirect_uri", redirectUri)
                    .setQueryParameter("state", oidcState)
                    .build()
                    .toString();
        }
        transition(AuthFlowState.AUTHORIZATION_REQUESTED, "Contacting MitID");
        return authorizeUrl;
    }

    static String readRequestUri(String body) {
        try {
            JSONObject json = new JSONObject(body);
            JSONObject data = json.optJSONObject("data");
            String uri = data != null ? data.optString("requestUri", "") : "";
            if (uri.isEmpty()) {
                uri = json.optString("requestUri", "");
            }
            return uri.isEmpty() ? null : uri;
        } catch (JSONException e) {
            LogManager.getInstance().warn(LogCategory.AUTHENTICATION, "Authorization start returned a non-JSON body");
            return null;
        }
    }

    /**
     * Load the provider's entry page and walk to its login page, linking the CPR number first
     * if the provider asks for it here.
     */
    private PageResult openProviderLogin(String authorizeUrl, Credentials credentials) {
        PageResult page = browser.navigate(authorizeUrl,
                stopAt(PageKind.ENTRY_PAGE, PageKind.LOGIN_PAGE, PageKind.CPR_VERIFICATION));
        if (page.getKind() == PageKind.ENTRY_PAGE) {
            transition(AuthFlowState.PROVIDER_LOGIN_PAGE, "Opening MitID login");
            page = browser.navigate(page.getField(PageClassifier.FIELD_INDEX_URL),
                    stopAt(PageKind.LOGIN_PAGE, PageKind.CPR_VERIFICATION));
        } else if (page.getKind() == PageKind.LOGIN_PAGE || page.getKind() == PageKind.CPR_VERIFICATION) {
            transition(AuthFlowState.PROVIDER_LOGIN_PAGE, "Opening MitID login");
        } else {
            throw unexpected(page, "the MitID entry page");
        }

        if (page.getKind() == PageKind.CPR_VERIFICATION) {
            page = browser.follow(verifyIdentity(page, credentials), stopAt(PageKind.LOGIN_PAGE));
        }
        if (page.getKind() != PageKind.LOGIN_PAGE) {
            throw unexpected(page, "the MitID login page");
        }
        if (page.getField(PageClassifier.FIELD_AUTH_CODE_PATH) == null
                || page.getField(PageClassifier.FIELD_FINALIZE_AUTH_PATH) == null) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "MitID login page is missing its auth-code or finalize endpoints");
        }
        return page;
    }

    /**
     * Start the app approval, wait for the user, then hand the code back to the provider.
     *
     * @return the provider's response to the finalize request, the start of the callback chain
     */
    private PageResult approveInApp(PageResult loginPage, Credentials credentials) {
        String baseUrl = loginPage.getField(PageClassifier.FIELD_BASE_URL);
        PageResult init = browser.post(resolve(loginPage, baseUrl + loginPage.getField(PageClassifier.FIELD_INIT_AUTH_PATH)),
                RequestBody.create(new byte[0]), Collections.emptyMap());
        if (init.getKind() != PageKind.APPROVAL_PENDING) {
            throw unexpected(init, "the MitID hand-over payload");
        }

        transition(AuthFlowState.APP_APPROVAL_PENDING, "Approve the login in your MitID app");
        String sessionId = MitIdApprovalClient.decodeAuthenticationSessionId(init.getField(PageClassifier.FIELD_AUX));
        MitIdApprovalClient mitId = new MitIdApprovalClient(browser, configManager, cancellationToken, listener);
        MitIdApprovalClient.ApprovalRequest request = mitId.begin(sessionId, credentials.getUserId());
        mitId.awaitApproval(request);
        String authCode = mitId.finalizeSession(request);
        listener.onStatus("MitID authentication successful");
        LogManager.getInstance().debug(LogCategory.AUTHENTICATION, "MitID auth code received (len=" + authCode.length() + ")");

        RequestBody multipart = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("authCode", authCode)
                .build();
        PageResult handOff = browser.post(resolve(loginPage, baseUrl + loginPage.getField(PageClassifier.FIELD_AUTH_CODE_PATH)),
                multipart, Collections.emptyMap());
        if (handOff.getStatusCode() >= 400) {
            throw unexpected(handOff, "acceptance of the MitID auth code");
        }
        return browser.get(resolve(loginPage, baseUrl + loginPage.getField(PageClassifier.FIELD_FINALIZE_AUTH_PATH)));
    }

    /**
     * Link the CPR number to the MitID identity.
     *
     * @return the provider's response to the CPR finalize request
     */
    private PageResult verifyIdentity(PageResult cprPage, Credentials credentials) {
        transition(AuthFlowState.CPR_VERIFICATION, "CPR verification required");
        String baseUrl = cprPage.getField(PageClassifier.FIELD_BASE_URL);
        String verifyPath = cprPage.getField(PageClassifier.FIELD_VERIFY_PATH);
        String finalizePath = cprPage.getField(PageClassifier.FIELD_FINALIZE_CPR_PATH);
        if (baseUrl == null || verifyPath == null || finalizePath == null) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE, "CPR form not found");
        }

        String cpr = credentials.hasCprNumber() ? credentials.getCprNumber() : askForCpr();
        if (cpr == null || cpr.isBlank()) {
            throw AuthFlowException.rejected(AuthFlowException.REASON_CPR_NOT_PROVIDED, "No CPR number was given");
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("cpr", cpr.trim());
        form.put("remember", "false");
        PageResult verify = browser.postForm(resolve(cprPage, baseUrl + verifyPath), form);
        if (verify.getStatusCode() != 200 || reportsFailure(verify.getBody())) {
            throw AuthFlowException.rejected(AuthFlowException.REASON_CPR_REJECTED,
                    "CPR verification failed (status " + verify.getStatusCode() + ")");
        }
        listener.onStatus("CPR verified successfully");
        LogManager.getInstance().info(LogCategory.AUTHENTICATION, "CPR number verified");
        return browser.get(resolve(cprPage, baseUrl + finalizePath));
    }

    private String askForCpr() {
        try {
            String answer = listener.requestInput("Please enter your CPR number (DDMMYYXXXX): ");
            cancellationToken.throwIfCancelled();
            return answer;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AuthFlowException.cancelled();
        }
    }

    static boolean reportsFailure(String body) {
        if (body.contains("\"success\":false")) {
            return true;
        }
        try {
            return !new JSONObject(body).optBoolean("success", true);
        } catch (JSONException e) {
            return false;
        }
    }

    /**
     * Trade the intercepted authorization code for a brokerage session.
     */
    private SessionArtifact exchangeCallback(PageResult callback) {
        transition(AuthFlowState.CALLBACK_EXCHANGE, "Completing login");
        String error = callback.getField(PageClassifier.FIELD_ERROR);
        if (error != null) {
            throw AuthFlowException.rejected(AuthFlowException.REASON_IDENTITY_REJECTED,
                    "Identity provider returned error '" + error + "'");
        }
        String code = callback.getField(PageClassifier.FIELD_CODE);
        if (code == null || code.isEmpty()) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "Broker callback carried no authorization code");
        }
        LogManager.getInstance().info(LogCategory.AUTHENTICATION, "Intercepted authorization code (len=" + code.length() + ")");

        browser.get(brokerUrl.resolve("logind").toString());

        JSONObject payload = new JSONObject()
                .put("authenticationProvider", "SIGNICAT")
                .put("countryCode", "DK")
                .put("signicat", new JSONObject()
                        .put("authorizationCode", code)
                        .put("redirectUri", configManager.getBrokerRedirectUri())
                        .put("useDtp", true));
        PageResult sessions = browser.postJson(brokerUrl.resolve(SESSIONS_PATH).toString(), payload, brokerHeaders(NO_NTAG));
        requireBrokerSuccess(sessions, "Sessions");

        PageResult login = browser.postJson(brokerUrl.resolve(NNX_LOGIN_PATH).toString(), new JSONObject(), brokerHeaders(NO_NTAG));
        requireBrokerSuccess(login, "Login");
        String ntag = login.getHeader("ntag");
        if (ntag == null || ntag.isEmpty()) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "Broker login response carried no ntag header");
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("client-id", CLIENT_ID);
        headers.put("ntag", ntag);
        SessionArtifact artifact = new SessionArtifact(cookieJar.cookiesFor(brokerUrl), headers, Instant.now(),
                readBrokerUserId(login.getBody()));
        if (!artifact.hasCredentials()) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "Broker login completed without session cookies");
        }
        LogManager.getInstance().info(LogCategory.AUTHENTICATION,
                "Brokerage session established (cookies: " + artifact.getCookies().keySet() + ")");
        return artifact;
    }

    private Map<String, String> brokerHeaders(String ntag) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("client-id", CLIENT_ID);
        headers.put("ntag", ntag);
        headers.put("accept", "application/json");
        headers.put("origin", configManager.getBrokerBaseUrl());
        headers.put("referer", brokerUrl.toString());
        return headers;
    }

    private static String readBrokerUserId(String body) {
        try {
            String id = new JSONObject(body).optString("user_id", "");
            return id.isEmpty() ? null : id;
        } catch (JSONException e) {
            return null;
        }
    }

    private static void requireBrokerSuccess(PageResult result, String step) {
        if (result.getStatusCode() == 200) {
            return;
        }
        if (result.getStatusCode() >= 500) {
            throw AuthFlowException.networkError(step + " request failed with status " + result.getStatusCode(), null);
        }
        throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                step + " request failed with status " + result.getStatusCode());
    }

    private static String resolve(PageResult page, String target) {
        HttpUrl resolved = HttpUrl.get(page.getUrl()).resolve(target);
        if (resolved == null) {
            throw AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                    "Page at " + RedirectContext.loggable(page.getUrl()) + " points to an invalid URL");
        }
        return resolved.toString();
    }

    private static AuthFlowException unexpected(PageResult page, String expected) {
        if (page.getKind() == PageKind.CALLBACK && page.getField(PageClassifier.FIELD_ERROR) != null) {
            return AuthFlowException.rejected(AuthFlowException.REASON_IDENTITY_REJECTED,
                    "Identity provider returned error '" + page.getField(PageClassifier.FIELD_ERROR) + "'");
        }
        if (page.getStatusCode() >= 500) {
            return AuthFlowException.networkError("Expected " + expected + " but got status "
                    + page.getStatusCode() + " from " + RedirectContext.loggable(page.getUrl()), null);
        }
        LogManager.getInstance().debug(LogCategory.AUTHENTICATION, "Unexpected page body: "
                + page.getBody().substring(0, Math.min(300, page.getBody().length())));
        return AuthFlowException.protocolMismatch(AuthFlowException.REASON_UNEXPECTED_PAGE,
                "Expected " + expected + " but got " + page.getKind() + " (status " + page.getStatusCode()
                        + ") at " + RedirectContext.loggable(page.getUrl()));
    }

    private void transition(AuthFlowState next, String message) {
        state = next;
        history.add(next);
        LogManager.getInstance().info(LogCategory.AUTHENTICATION, "Login state: " + next + " - " + message);
        try {
            listener.onStateChanged(next, message);
        } catch (RuntimeException e) {
            LogManager.getInstance().error(LogCategory.AUTHENTICATION, "Progress listener failed: " + e.getMessage(), e);
        }
    }
}

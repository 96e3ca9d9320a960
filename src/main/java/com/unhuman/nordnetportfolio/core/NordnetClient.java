package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.SessionArtifact;
import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Client for the Nordnet APIs on top of an authenticated session.
 * <p>
 * When the broker answers 401 the client re-authenticates exactly once through its
 * {@link Reauthenticator} and repeats the request; a second 401 is thrown as
 * {@link AuthenticationFailedException}. Concurrent failures share a single re-authentication.
 */
public class NordnetClient {
    static final int TRANSACTION_PAGE_SIZE = 800;
    static final Duration TOKEN_REFRESH_MARGIN = Duration.ofSeconds(30);
    private static final String TRANSACTIONS_PATH = "/transaction/transaction-and-notes/v1";
    private static final String TRANSACTIONS_FROM_DATE = "2010-01-01";

    private final OkHttpClient httpClient;
    private final String brokerBaseUrl;
    private final String apiBaseUrl;
    private final Reauthenticator reauthenticator;
    private final AtomicReference<SessionArtifact> session;
    private final Object reauthLock = new Object();

    private final Object tokenLock = new Object();
    private String bearerToken;
    private Instant tokenExpiry;

    public NordnetClient(OkHttpClient httpClient, ConfigManager configManager,
                         SessionArtifact session, Reauthenticator reauthenticator) {
        this.httpClient = httpClient;
        this.brokerBaseUrl = configManager.getBrokerBaseUrl();
        this.apiBaseUrl = configManager.getApiBaseUrl();
        this.reauthenticator = reauthenticator;
        this.session = new AtomicReference<>(session);
    }

    public SessionArtifact getSession() {
        return session.get();
    }

    public JSONArray getAccounts() {
        return asArray(getLegacy("/api/2/accounts"));
    }

    public JSONObject getAccountInfo(long accid) {
        Object info = getLegacy("/api/2/accounts/" + accid + "/info");
        // the info endpoint wraps its object in a one-element array
        if (info instanceof JSONArray) {
            JSONArray array = (JSONArray) info;
            return array.isEmpty() ? new JSONObject() : array.getJSONObject(0);
        }
        return (JSONObject) info;
    }

    public JSONArray getPositions(long accid) {
        return asArray(getLegacy("/api/2/accounts/" + accid + "/positions"));
    }

    public JSONArray getTrades(long accid) {
        return asArray(getLegacy("/api/2/accounts/" + accid + "/trades"));
    }

    public JSONArray getOrders(long accid) {
        return asArray(getLegacy("/api/2/accounts/" + accid + "/orders"));
    }

    /**
     * Every transaction of the account since 2010, newest first, fetched in pages.
     *
     * @param progress called after each page with (fetched so far, total reported); may be null
     */
    public List<JSONObject> getTransactions(long accid, TransactionProgress progress) {
        String toDate = LocalDate.now().toString();
        Map<String, String> common = new LinkedHashMap<>();
        common.put("accids", String.valueOf(accid));
        common.put("fromDate", TRANSACTIONS_FROM_DATE);
        common.put("toDate", toDate);
        common.put("includeCancellations", "false");

        JSONObject summary = (JSONObject) getWithBearer(TRANSACTIONS_PATH + "/transaction-summary", common);
        int total = summary.optInt("totalNumberOfTransactions", summary.optInt("numberOfTransactions", 0));

        List<JSONObject> transactions = new ArrayList<>();
        int offset = 0;
        while (true) {
            Map<String, String> params = new LinkedHashMap<>(common);
            params.put("offset", String.valueOf(offset));
            params.put("limit", String.valueOf(TRANSACTION_PAGE_SIZE));
            params.put("sort", "ACCOUNTING_DATE");
            params.put("sortOrder", "DESC");

            Object page = getWithBearer(TRANSACTIONS_PATH + "/transactions/page", params);
            JSONArray batch = page instanceof JSONArray
                    ? (JSONArray) page
                    : ((JSONObject) page).optJSONArray("transactions");
            if (batch == null || batch.isEmpty()) {
                break;
            }
            for (int i = 0; i < batch.length(); i++) {
                transactions.add(batch.getJSONObject(i));
            }
            if (progress != null) {
                progress.onProgress(transactions.size(), total);
            }
            if (batch.length() < TRANSACTION_PAGE_SIZE) {
                break;
            }
            offset += TRANSACTION_PAGE_SIZE;
        }
        LogManager.getInstance().info(LogCategory.DATA_FETCH,
                "Fetched " + transactions.size() + " transactions for account " + accid);
        return transactions;
    }

    /**
     * GET on the session-cookie API. 204 means an empty list.
     */
    public Object getLegacy(String path) {
        HttpResult result = executeAuthenticated(artifact ->
                SessionHeaders.apply(new Request.Builder().url(brokerBaseUrl + path).get(), artifact).build());
        if (result.code == 204) {
            return new JSONArray();
        }
        if (result.code != 200) {
            throw new NordnetApiException(result.code, abbreviate(result.body));
        }
        return parse(result.body);
    }

    /**
     * Seconds until the bearer token expires, or -1 when there is none.
     */
    public long getTokenSecondsRemaining() {
        synchronized (tokenLock) {
            if (tokenExpiry == null) {
                return -1;
            }
            return Math.max(0, Duration.between(Instant.now(), tokenExpiry).getSeconds());
        }
    }

    /**
     * Run a session-authenticated request, re-authenticating once on 401.
     */
    HttpResult executeAuthenticated(Function<SessionArtifact, Request> requestFactory) {
        SessionArtifact current = session.get();
        HttpResult result = execute(requestFactory.apply(current));
        if (result.code != 401) {
            return result;
        }

        LogManager.getInstance().info(LogCategory.SESSION, "Broker rejected the session (401), re-authenticating once");
        SessionArtifact fresh = reauthenticate(current);
        result = execute(requestFactory.apply(fresh));
        if (result.code == 401) {
            throw new AuthenticationFailedException("Nordnet rejected the session again after re-authentication");
        }
        return result;
    }

    private SessionArtifact reauthenticate(SessionArtifact rejected) {
        synchronized (reauthLock) {
            SessionArtifact current = session.get();
            if (current != rejected) {
                // another request already logged in again
                return current;
            }
            SessionArtifact fresh;
            try {
                fresh = reauthenticator.reauthenticate(rejected);
            } catch (AuthFlowException e) {
                throw new AuthenticationFailedException("Re-authentication failed: " + e.getMessage(), e);
            }
            if (fresh == null) {
                throw new AuthenticationFailedException("Re-authentication produced no session");
            }
            session.set(fresh);
            synchronized (tokenLock) {
                bearerToken = null;
                tokenExpiry = null;
            }
            return fresh;
        }
    }

    private Object getWithBearer(String path, Map<String, String> params) {
        HttpUrl.Builder url = HttpUrl.get(apiBaseUrl + path).newBuilder();
        params.forEach(url::addQueryParameter);
        HttpUrl target = url.build();

        for (int attempt = 0; attempt < 2; attempt++) {
            String token = getBearerToken(attempt > 0);
            Request request = new Request.Builder()
                    .url(target)
                    .header("Authorization", "Bearer " + token)
                    .header("client-id", AuthFlowController.CLIENT_ID)
                    .header("x-locale", "da-DK")
                    .header("accept", "application/json")
                    .get()
                    .build();
            HttpResult result = execute(request);
            if (result.code == 401 && attempt == 0) {
                LogManager.getInstance().info(LogCategory.DATA_FETCH, "Bearer token rejected, fetching a new one");
                continue;
            }
            if (result.code == 401) {
                throw new AuthenticationFailedException("Nordnet rejected a freshly issued bearer token");
            }
            if (result.code != 200) {
                throw new NordnetApiException(result.code, abbreviate(result.body));
            }
            return parse(result.body);
        }
        throw new IllegalStateException("unreachable");
    }

    String getBearerToken(boolean forceRefresh) {
        synchronized (tokenLock) {
            if (!forceRefresh && bearerToken != null
                    && (tokenExpiry == null || Instant.now().plus(TOKEN_REFRESH_MARGIN).isBefore(tokenExpiry))) {
                return bearerToken;
            }
        }

        HttpResult result = executeAuthenticated(artifact -> SessionHeaders.apply(new Request.Builder()
                        .url(brokerBaseUrl + "/nnxapi/authorization/v1/tokens")
                        .post(RequestBody.create("{}", BrowserEmulationClient.JSON)), artifact)
                .build());
        if (result.code != 200 && result.code != 201) {
            throw new NordnetApiException(result.code, "Failed to obtain bearer token");
        }
        String token;
        try {
            token = new JSONObject(result.body).optString("jwt", "");
        } catch (JSONException e) {
            throw new NordnetApiException(result.code, "Bearer token response is not JSON");
        }
        if (token.isEmpty()) {
            throw new NordnetApiException(result.code, "Bearer token response carried no jwt");
        }

        synchronized (tokenLock) {
            bearerToken = token;
            tokenExpiry = parseJwtExpiry(token);
            LogManager.getInstance().debug(LogCategory.DATA_FETCH, "Obtained bearer token, expires " + tokenExpiry);
            return bearerToken;
        }
    }

    /**
     * The {@code exp} claim of a JWT, or null when it cannot be read.
     */
    static Instant parseJwtExpiry(String token) {
        if (token == null) {
            return null;
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return null;
        }
        try {
            String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            long exp = new JSONObject(payload).optLong("exp", 0);
            return exp > 0 ? Instant.ofEpochSecond(exp) : null;
        } catch (IllegalArgumentException | JSONException e) {
            return null;
        }
    }

    private HttpResult execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            LogManager.getInstance().debug(LogCategory.DATA_FETCH,
                    request.method() + " " + request.url().encodedPath() + " -> " + response.code());
            return new HttpResult(response.code(), text);
        } catch (IOException e) {
            LogManager.getInstance().error(LogCategory.DATA_FETCH,
                    "Request to " + request.url().encodedPath() + " failed: " + e.getMessage());
            throw new NordnetApiException("Network error calling " + request.url().encodedPath() + ": " + e.getMessage(), e);
        }
    }

    private static Object parse(String body) {
        String trimmed = body.trim();
        try {
            if (trimmed.startsWith("[")) {
                return new JSONArray(trimmed);
            }
            return new JSONObject(trimmed);
        } catch (JSONException e) {
            throw new NordnetApiException(200, "Response is not JSON: " + abbreviate(body));
        }
    }

    private static JSONArray asArray(Object value) {
        if (value instanceof JSONArray) {
            return (JSONArray) value;
        }
        throw new NordnetApiException(200, "Expected a JSON array");
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200);
    }

    /** Progress of a paginated transaction download. */
    @FunctionalInterface
    public interface TransactionProgress {
        void onProgress(int fetched, int total);
    }

    static final class HttpResult {
        final int code;
        final String body;

        HttpResult(int code, String body) {
            this.code = code;
            this.body = body;
        }
    }
}

package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.util.HtmlUtil.HtmlForm;
import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;
import okhttp3.Call;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.json.JSONObject;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Drives the identity provider's pages the way a browser would: one request at a time, no
 * automatic redirects, cookies in the attempt's jar, every response classified.
 * Redirects and auto-submitting forms are followed by {@link #follow(PageResult, Set)} under the
 * context's redirect ceiling.
 */
public class BrowserEmulationClient {
    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final RedirectContext context;
    private final PageClassifier classifier;
    private final CancellationToken cancellationToken;

    public BrowserEmulationClient(OkHttpClient httpClient, RedirectContext context,
                                  PageClassifier classifier, CancellationToken cancellationToken) {
        this.httpClient = httpClient;
        this.context = context;
        this.classifier = classifier;
        this.cancellationToken = cancellationToken;
    }

    public RedirectContext getContext() {
        return context;
    }

    public PageResult get(String url) {
        return execute(new Request.Builder().url(url).get(), Collections.emptyMap(), 0);
    }

    public PageResult get(String url, Map<String, String> headers) {
        return execute(new Request.Builder().url(url).get(), headers, 0);
    }

    public PageResult postForm(String url, Map<String, String> formFields) {
        FormBody.Builder form = new FormBody.Builder();
        formFields.forEach(form::add);
        return post(url, form.build(), Collections.emptyMap());
    }

    public PageResult postJson(String url, JSONObject json, Map<String, String> headers) {
        return post(url, RequestBody.create(json.toString(), JSON), headers);
    }

    public PageResult post(String url, RequestBody body, Map<String, String> headers) {
        return execute(new Request.Builder().url(url).post(body), headers, 0);
    }

    public PageResult putJson(String url, JSONObject json) {
        return execute(new Request.Builder().url(url).put(RequestBody.create(json.toString(), JSON)),
                Collections.emptyMap(), 0);
    }

    /**
     * POST with a per-call deadline shorter than the client's own, used for approval polls.
     */
    public PageResult postJson(String url, JSONObject json, long timeoutMillis) {
        return execute(new Request.Builder().url(url).post(RequestBody.create(json.toString(), JSON)),
                Collections.emptyMap(), timeoutMillis);
    }

    /**
     * GET {@code url} and follow redirects and auto-submitting forms until a page of one of the
     * {@code stopAt} kinds, or any page that cannot be followed, is reached.
     */
    public PageResult navigate(String url, Set<PageKind> stopAt) {
        return follow(get(url), stopAt);
    }

    public PageResult follow(PageResult start, Set<PageKind> stopAt) {
        context.beginChain();
        PageResult current = start;
        while (!stopAt.contains(current.getKind())) {
            if (current.getKind() == PageKind.REDIRECT) {
                String target = current.getField(PageClassifier.FIELD_LOCATION);
                context.recordRedirect(target);
                LogManager.getInstance().debug(LogCategory.AUTHENTICATION,
                        "Redirect hop " + context.getRedirectCount() + ": " + current.getStatusCode() + " -> " + RedirectContext.loggable(target));
                current = get(target);
            } else if (current.getKind() == PageKind.AUTO_SUBMIT_FORM) {
                HtmlForm form = current.getForm();
                context.recordRedirect(form.getAction());
                LogManager.getInstance().debug(LogCategory.AUTHENTICATION,
                        "Form hop " + context.getRedirectCount() + ": " + form.getMethod() + " " + RedirectContext.loggable(form.getAction())
                                + " (fields=" + form.getFields().keySet() + ")");
                current = submit(form);
            } else {
                break;
            }
        }
        return current;
    }

    public PageResult submit(HtmlForm form) {
        if (form.isPost()) {
            return postForm(form.getAction(), form.getFields());
        }
        HttpUrl action = HttpUrl.get(form.getAction());
        HttpUrl.Builder url = action.newBuilder();
        form.getFields().forEach(url::addQueryParameter);
        return get(url.build().toString());
    }

    static Set<PageKind> stopAt(PageKind first, PageKind... rest) {
        return EnumSet.of(first, rest);
    }

    private PageResult execute(Request.Builder builder, Map<String, String> headers, long timeoutMillis) {
        cancellationToken.throwIfCancelled();
        headers.forEach(builder::header);
        Request request = builder.build();

        Call call = httpClient.newCall(request);
        if (timeoutMillis > 0) {
            call.timeout().timeout(timeoutMillis, TimeUnit.MILLISECONDS);
        }
        cancellationToken.register(call);
        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            String contentType = response.header("Content-Type");
            HttpUrl url = response.request().url();

            PageClassifier.Classification classification =
                    classifier.classify(response.code(), url, response.header("Location"), contentType, body);
            context.navigatedTo(url.toString(), classification.getFields());

            LogManager.getInstance().debug(LogCategory.AUTHENTICATION,
                    request.method() + " " + RedirectContext.loggable(url.toString())
                            + " -> " + response.code() + " " + classification.getKind());

            return new PageResult(classification.getKind(), response.code(), url.toString(),
                    classification.getFields(), classification.getForm(),
                    context.getCookieJar().cookiesFor(url), response.headers(), body);
        } catch (IOException e) {
            if (cancellationToken.isCancelled()) {
                throw AuthFlowException.cancelled();
            }
            throw AuthFlowException.networkError(
                    "Request to " + request.url().host() + " failed: " + e.getMessage(), e);
        } finally {
            cancellationToken.unregister(call);
        }
    }
}

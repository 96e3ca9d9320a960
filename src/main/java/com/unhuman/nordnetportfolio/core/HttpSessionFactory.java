package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;
import okhttp3.CookieJar;
import okhttp3.OkHttpClient;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;

/**
 * Builds the HTTP clients used for logging in and for API calls.
 * All clients share one connection pool and honour the configured SOCKS5 proxy and
 * certificate setting. Redirects are never followed by the client itself.
 */
public class HttpSessionFactory {
    static final String USER_AGENT =
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private final ConfigManager configManager;
    private volatile OkHttpClient baseClient;

    public HttpSessionFactory(ConfigManager configManager) {
        this.configManager = configManager;
    }

    /**
     * Client with its own cookie jar, for one login attempt.
     */
    public OkHttpClient newSession(CookieJar cookieJar) {
        return baseClient().newBuilder()
                .cookieJar(cookieJar)
                .build();
    }

    /**
     * Client without cookie handling; callers send the session cookies explicitly.
     */
    public OkHttpClient newClient() {
        return baseClient();
    }

    /**
     * Drop the cached client so the next call picks up changed proxy or certificate settings.
     */
    public synchronized void reset() {
        baseClient = null;
    }

    private OkHttpClient baseClient() {
        OkHttpClient client = baseClient;
        if (client == null) {
            synchronized (this) {
                if (baseClient == null) {
                    baseClient = createBaseClient();
                }
                client = baseClient;
            }
        }
        return client;
    }

    private OkHttpClient createBaseClient() {
        Duration timeout = Duration.ofSeconds(configManager.getRequestTimeoutSeconds());
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .followRedirects(false)
                .followSslRedirects(false)
                .addInterceptor(chain -> {
                    if (chain.request().header("User-Agent") != null) {
                        return chain.proceed(chain.request());
                    }
                    return chain.proceed(chain.request().newBuilder()
                            .header("User-Agent", USER_AGENT)
                            .build());
                });

        Proxy proxy = parseProxy(configManager.getProxy());
        if (proxy != null) {
            LogManager.getInstance().info(LogCategory.GENERAL, "Routing traffic through SOCKS5 proxy " + configManager.getProxy());
            builder.proxy(proxy);
        }

        if (configManager.getIgnoreCertValidation()) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "SSL certificate validation is DISABLED");
            applyTrustAll(builder);
        }
        return builder.build();
    }

    /**
     * Parse {@code host:port} into a SOCKS proxy. Null or blank means no proxy.
     */
    static Proxy parseProxy(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String hostPort = value.trim();
        if (hostPort.startsWith("socks5://")) {
            hostPort = hostPort.substring("socks5://".length());
        }
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1) {
            throw new IllegalArgumentException("Proxy must be host:port, got: " + value);
        }
        int port;
        try {
            port = Integer.parseInt(hostPort.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid proxy port in: " + value, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Proxy port out of range in: " + value);
        }
        String host = hostPort.substring(0, colon);
        if (host.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Proxy must be host:port, got: " + value);
        }
        return new Proxy(Proxy.Type.SOCKS, InetSocketAddress.createUnresolved(host, port));
    }

    private static void applyTrustAll(OkHttpClient.Builder builder) {
        try {
            X509TrustManager trustAll = new X509TrustManager() {
                public void checkClientTrusted(X509Certificate[] chain, String authType) {}
                public void checkServerTrusted(X509Certificate[] chain, String authType) {}
                public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
            };
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[] { trustAll }, new SecureRandom());
            builder.sslSocketFactory(sslContext.getSocketFactory(), trustAll)
                    .hostnameVerifier((hostname, session) -> true);
        } catch (Exception e) {
            LogManager.getInstance().error(LogCategory.GENERAL,
                    "Error creating HTTP client without certificate validation: " + e.getMessage(), e);
        }
    }
}

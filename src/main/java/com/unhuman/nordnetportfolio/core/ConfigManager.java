package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Manages configuration settings for NordnetPortfolio: endpoints, proxy, session file location
 * and the timing bounds of the login flow.
 */
public class ConfigManager {
    public static final String APP_DIR = ".nordnetportfolio";
    public static final String DEFAULT_BROKER_BASE_URL = "https://www.nordnet.dk";
    public static final String DEFAULT_API_BASE_URL = "https://api.prod.nntech.io";
    public static final String DEFAULT_MITID_BASE_URL = "https://www.mitid.dk/mitid-core-client-backend";
    public static final String DEFAULT_FALLBACK_AUTHORIZE_URL =
            "https://nordnet-login.app.signicat.com/auth/open/connect/authorize"
            + "?client_id=prod-joyous-bag-934&response_type=code&scope=openid+nin";

    private static final long DEFAULT_POLL_INTERVAL_MILLIS = 2000;
    private static final int DEFAULT_APPROVAL_TIMEOUT_SECONDS = 300;
    private static final int DEFAULT_MAX_REDIRECTS = 15;
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_SESSION_LIFETIME_MINUTES = 30;

    private final String configFilePath;
    private final Properties properties = new Properties();
    private String userId;
    private String proxy;
    private boolean ignoreCertValidation = false;
    private String sessionFile;
    private String brokerBaseUrl = DEFAULT_BROKER_BASE_URL;
    private String apiBaseUrl = DEFAULT_API_BASE_URL;
    private String mitIdBaseUrl = DEFAULT_MITID_BASE_URL;
    private String fallbackAuthorizeUrl = DEFAULT_FALLBACK_AUTHORIZE_URL;
    private long pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;
    private int approvalTimeoutSeconds = DEFAULT_APPROVAL_TIMEOUT_SECONDS;
    private int maxRedirects = DEFAULT_MAX_REDIRECTS;
    private int requestTimeoutSeconds = DEFAULT_REQUEST_TIMEOUT_SECONDS;
    private int sessionLifetimeMinutes = DEFAULT_SESSION_LIFETIME_MINUTES;

    public ConfigManager(String configFilePath) {
        this.configFilePath = configFilePath;
        this.sessionFile = defaultSessionFile();
        LogManager.getInstance().info(LogCategory.GENERAL, "ConfigManager initialized with path: " + configFilePath);
    }

    public static String defaultConfigPath() {
        return Paths.get(System.getProperty("user.home"), APP_DIR, "config.properties").toString();
    }

    private static String defaultSessionFile() {
        return Paths.get(System.getProperty("user.home"), APP_DIR, "session.json").toString();
    }

    public void loadConfiguration() {
        File configFile = new File(configFilePath);
        File configDir = configFile.getAbsoluteFile().getParentFile();
        if (configDir != null && !configDir.exists()) {
            configDir.mkdirs();
        }
        if (configFile.exists()) {
            try (FileInputStream fis = new FileInputStream(configFile)) {
                properties.load(fis);
                loadPropertiesFromConfig();
                LogManager.getInstance().info(LogCategory.GENERAL, "Configuration loaded from " + configFilePath);
            } catch (Exception e) {
                LogManager.getInstance().error(LogCategory.GENERAL, "Error loading configuration: " + e.getMessage());
                createDefaultConfig(configFile);
            }
        } else {
            createDefaultConfig(configFile);
        }
    }

    private void createDefaultConfig(File configFile) {
        LogManager.getInstance().info(LogCategory.GENERAL, "Creating default configuration at " + configFile.getAbsolutePath());
        properties.clear();
        properties.setProperty("userId", "");
        properties.setProperty("proxy", "");
        properties.setProperty("ignoreCertValidation", "false");
        properties.setProperty("sessionFile", defaultSessionFile());
        properties.setProperty("brokerBaseUrl", DEFAULT_BROKER_BASE_URL);
        properties.setProperty("apiBaseUrl", DEFAULT_API_BASE_URL);
        properties.setProperty("mitIdBaseUrl", DEFAULT_MITID_BASE_URL);
        properties.setProperty("fallbackAuthorizeUrl", DEFAULT_FALLBACK_AUTHORIZE_URL);
        properties.setProperty("pollIntervalMillis", String.valueOf(DEFAULT_POLL_INTERVAL_MILLIS));
        properties.setProperty("approvalTimeoutSeconds", String.valueOf(DEFAULT_APPROVAL_TIMEOUT_SECONDS));
        properties.setProperty("maxRedirects", String.valueOf(DEFAULT_MAX_REDIRECTS));
        properties.setProperty("requestTimeoutSeconds", String.valueOf(DEFAULT_REQUEST_TIMEOUT_SECONDS));
        properties.setProperty("sessionLifetimeMinutes", String.valueOf(DEFAULT_SESSION_LIFETIME_MINUTES));
        try (FileOutputStream fos = new FileOutputStream(configFile)) {
            properties.store(fos, "NordnetPortfolio Configuration");
            LogManager.getInstance().info(LogCategory.GENERAL,
                "Configuration file created at " + configFile.getAbsolutePath() + "\n\n" +
                "Edit the configuration file to set:\n\n" +
                "1. userId - Your MitID user identifier (can also be given with --user)\n" +
                "2. proxy - host:port of a SOCKS5 proxy (optional)\n" +
                "3. approvalTimeoutSeconds - How long to wait for approval in the MitID app\n");
        } catch (Exception e) {
            LogManager.getInstance().error(LogCategory.GENERAL, "Error creating default configuration: " + e.getMessage());
        }
        loadPropertiesFromConfig();
    }

    private void loadPropertiesFromConfig() {
        userId = properties.getProperty("userId", "");
        proxy = properties.getProperty("proxy", "");
        ignoreCertValidation = Boolean.parseBoolean(properties.getProperty("ignoreCertValidation", "false"));
        String sessionFileValue = properties.getProperty("sessionFile");
        sessionFile = (sessionFileValue == null || sessionFileValue.trim().isEmpty())
                ? defaultSessionFile() : sessionFileValue.trim();
        brokerBaseUrl = trimTrailingSlash(properties.getProperty("brokerBaseUrl", DEFAULT_BROKER_BASE_URL));
        apiBaseUrl = trimTrailingSlash(properties.getProperty("apiBaseUrl", DEFAULT_API_BASE_URL));
        mitIdBaseUrl = trimTrailingSlash(properties.getProperty("mitIdBaseUrl", DEFAULT_MITID_BASE_URL));
        fallbackAuthorizeUrl = properties.getProperty("fallbackAuthorizeUrl", DEFAULT_FALLBACK_AUTHORIZE_URL);
        try {
            pollIntervalMillis = Long.parseLong(properties.getProperty("pollIntervalMillis",
                    String.valueOf(DEFAULT_POLL_INTERVAL_MILLIS)).trim());
        } catch (NumberFormatException e) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "Invalid pollIntervalMillis value, using default: " + e.getMessage());
            pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;
        }
        approvalTimeoutSeconds = parseInt("approvalTimeoutSeconds", DEFAULT_APPROVAL_TIMEOUT_SECONDS);
        maxRedirects = parseInt("maxRedirects", DEFAULT_MAX_REDIRECTS);
        requestTimeoutSeconds = parseInt("requestTimeoutSeconds", DEFAULT_REQUEST_TIMEOUT_SECONDS);
        sessionLifetimeMinutes = parseInt("sessionLifetimeMinutes", DEFAULT_SESSION_LIFETIME_MINUTES);
    }

    private int parseInt(String key, int defaultValue) {
        try {
            return Integer.parseInt(properties.getProperty(key, String.valueOf(defaultValue)).trim());
        } catch (NumberFormatException e) {
            LogManager.getInstance().warn(LogCategory.GENERAL, "Invalid " + key + " value, using default: " + e.getMessage());
            return defaultValue;
        }
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Checks the values the login flow depends on.
     *
     * @throws IllegalStateException naming the first invalid setting
     */
    public void validate() {
        requireUrl("brokerBaseUrl", brokerBaseUrl);
        requireUrl("apiBaseUrl", apiBaseUrl);
        requireUrl("mitIdBaseUrl", mitIdBaseUrl);
        if (pollIntervalMillis <= 0) {
            throw new IllegalStateException("pollIntervalMillis must be positive: " + pollIntervalMillis);
        }
        if (approvalTimeoutSeconds <= 0) {
            throw new IllegalStateException("approvalTimeoutSeconds must be positive: " + approvalTimeoutSeconds);
        }
        if (maxRedirects <= 0) {
            throw new IllegalStateException("maxRedirects must be positive: " + maxRedirects);
        }
        if (requestTimeoutSeconds <= 0) {
            throw new IllegalStateException("requestTimeoutSeconds must be positive: " + requestTimeoutSeconds);
        }
        try {
            HttpSessionFactory.parseProxy(proxy);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("proxy: " + e.getMessage(), e);
        }
    }

    private static void requireUrl(String key, String value) {
        if (value == null || !(value.startsWith("https://") || value.startsWith("http://"))) {
            throw new IllegalStateException(key + " must be an http(s) URL, got: " + value);
        }
    }

    public String getUserId() { return userId; }
    public String getProxy() { return proxy; }
    public boolean getIgnoreCertValidation() { return ignoreCertValidation; }
    public Path getSessionFile() { return Paths.get(sessionFile); }
    public String getBrokerBaseUrl() { return brokerBaseUrl; }
    public String getApiBaseUrl() { return apiBaseUrl; }
    public String getMitIdBaseUrl() { return mitIdBaseUrl; }
    public String getFallbackAuthorizeUrl() { return fallbackAuthorizeUrl; }
    public long getPollIntervalMillis() { return pollIntervalMillis; }
    public int getApprovalTimeoutSeconds() { return approvalTimeoutSeconds; }
    public int getMaxRedirects() { return maxRedirects; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public int getSessionLifetimeMinutes() { return sessionLifetimeMinutes; }

    /** The broker URL the identity provider redirects back to with the authorization code. */
    public String getBrokerRedirectUri() { return brokerBaseUrl + "/login"; }

    // Command-line overrides apply to this run only and are not written back.
    public void overrideUserId(String userId) { this.userId = userId; }
    public void overrideProxy(String proxy) { this.proxy = proxy; }
    public void overrideIgnoreCertValidation(boolean ignore) { this.ignoreCertValidation = ignore; }

    // Endpoint and timing overrides, used by tests pointing the flow at a local server.
    public void overrideEndpoints(String brokerBaseUrl, String apiBaseUrl, String mitIdBaseUrl) {
        this.brokerBaseUrl = trimTrailingSlash(brokerBaseUrl);
        this.apiBaseUrl = trimTrailingSlash(apiBaseUrl);
        this.mitIdBaseUrl = trimTrailingSlash(mitIdBaseUrl);
    }
    public void overrideFallbackAuthorizeUrl(String url) { this.fallbackAuthorizeUrl = url; }
    public void overrideTimings(long pollIntervalMillis, int approvalTimeoutSeconds, int requestTimeoutSeconds) {
        this.pollIntervalMillis = pollIntervalMillis;
        this.approvalTimeoutSeconds = approvalTimeoutSeconds;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
    public void overrideMaxRedirects(int maxRedirects) { this.maxRedirects = maxRedirects; }
    public void overrideSessionFile(String path) { this.sessionFile = path; }
}

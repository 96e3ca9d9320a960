package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.util.LogManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Properties;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    private Path tempDir;
    private String configPath;
    private ConfigManager configManager;

    @BeforeEach
    void setup() throws IOException {
        // Ensure LogManager is initialized
        LogManager.getInstance();

        tempDir = Files.createTempDirectory("nordnetportfolio-test");
        configPath = new File(tempDir.toFile(), "test-config.properties").getAbsolutePath();
        configManager = new ConfigManager(configPath);
    }

    @AfterEach
    void cleanup() throws IOException {
        deleteDirectory(tempDir);
    }

    static void deleteDirectory(Path dir) throws IOException {
        if (Files.exists(dir)) {
            try (Stream<Path> walk = Files.walk(dir)) {
                walk.sorted(Comparator.reverseOrder())
                    .map(Path::toFile)
                    .forEach(File::delete);
            }
        }
    }

    private void writeProperties(Properties props) throws IOException {
        try (FileOutputStream out = new FileOutputStream(configPath)) {
            props.store(out, "Test config");
        }
    }

    // ───────── Default Configuration ─────────

    @Nested
    @DisplayName("default configuration")
    class DefaultConfig {

        @Test
        @DisplayName("loadConfiguration creates default config file if none exists")
        void createsDefault() {
            assertFalse(new File(configPath).exists());
            configManager.loadConfiguration();
            assertTrue(new File(configPath).exists());
        }

        @Test
        @DisplayName("defaults have correct values")
        void defaultValues() {
            configManager.loadConfiguration();

            assertEquals("", configManager.getUserId());
            assertEquals("", configManager.getProxy());
            assertFalse(configManager.getIgnoreCertValidation());
            assertEquals("https://www.nordnet.dk", configManager.getBrokerBaseUrl());
            assertEquals("https://api.prod.nntech.io", configManager.getApiBaseUrl());
            assertEquals("https://www.mitid.dk/mitid-core-client-backend", configManager.getMitIdBaseUrl());
            assertEquals(2000, configManager.getPollIntervalMillis());
            assertEquals(300, configManager.getApprovalTimeoutSeconds());
            assertEquals(15, configManager.getMaxRedirects());
            assertEquals(30, configManager.getRequestTimeoutSeconds());
            assertEquals(30, configManager.getSessionLifetimeMinutes());
            assertEquals(Paths.get(System.getProperty("user.home"), ".nordnetportfolio", "session.json"),
                    configManager.getSessionFile());
        }

        @Test
        @DisplayName("broker redirect URI is the broker login path")
        void redirectUri() {
            configManager.loadConfiguration();
            assertEquals("https://www.nordnet.dk/login", configManager.getBrokerRedirectUri());
        }

        @Test
        @DisplayName("defaults pass validation")
        void defaultsValid() {
            configManager.loadConfiguration();
            assertDoesNotThrow(() -> configManager.validate());
        }
    }

    // ───────── Overrides ─────────

    @Nested
    @DisplayName("command-line overrides")
    class Overrides {

        @Test
        @DisplayName("file values are read and overrides replace them")
        void fileThenOverride() throws IOException {
            Properties props = new Properties();
            props.setProperty("userId", "U1");
            props.setProperty("proxy", "127.0.0.1:1080");
            props.setProperty("ignoreCertValidation", "true");
            props.setProperty("sessionFile", tempDir.resolve("s.json").toString());
            writeProperties(props);

            configManager.loadConfiguration();
            assertEquals("U1", configManager.getUserId());
            assertEquals("127.0.0.1:1080", configManager.getProxy());
            assertTrue(configManager.getIgnoreCertValidation());
            assertEquals(tempDir.resolve("s.json"), configManager.getSessionFile());

            configManager.overrideProxy("10.0.0.1:9050");
            assertEquals("10.0.0.1:9050", configManager.getProxy());
        }

        @Test
        @DisplayName("overrides apply to this run only")
        void overridesNotPersisted() {
            configManager.loadConfiguration();
            configManager.overrideUserId("U2");
            configManager.overrideProxy("127.0.0.1:1080");
            configManager.overrideIgnoreCertValidation(true);
            assertEquals("U2", configManager.getUserId());

            ConfigManager reloaded = new ConfigManager(configPath);
            reloaded.loadConfiguration();
            assertEquals("", reloaded.getUserId());
            assertEquals("", reloaded.getProxy());
            assertFalse(reloaded.getIgnoreCertValidation());
        }
    }

    // ───────── Existing Config Loading ─────────

    @Nested
    @DisplayName("loading existing config")
    class LoadExisting {

        @Test
        @DisplayName("loads existing config file with custom values")
        void loadCustom() throws IOException {
            Properties props = new Properties();
            props.setProperty("userId", "someone");
            props.setProperty("brokerBaseUrl", "https://broker.example/");
            props.setProperty("pollIntervalMillis", "500");
            props.setProperty("approvalTimeoutSeconds", "60");
            props.setProperty("maxRedirects", "5");
            writeProperties(props);

            configManager.loadConfiguration();

            assertEquals("someone", configManager.getUserId());
            assertEquals("https://broker.example", configManager.getBrokerBaseUrl());
            assertEquals(500, configManager.getPollIntervalMillis());
            assertEquals(60, configManager.getApprovalTimeoutSeconds());
            assertEquals(5, configManager.getMaxRedirects());
        }

        @Test
        @DisplayName("handles malformed numeric values gracefully (uses defaults)")
        void malformedValues() throws IOException {
            Properties props = new Properties();
            props.setProperty("pollIntervalMillis", "soon");
            props.setProperty("approvalTimeoutSeconds", "NaN");
            props.setProperty("maxRedirects", "many");
            writeProperties(props);

            // bad values fall back to defaults
            configManager.loadConfiguration();

            assertEquals(2000, configManager.getPollIntervalMillis());
            assertEquals(300, configManager.getApprovalTimeoutSeconds());
            assertEquals(15, configManager.getMaxRedirects());
        }

        @Test
        @DisplayName("creates parent directories if they don't exist")
        void createsParentDirs() {
            String nestedPath = new File(tempDir.toFile(), "a/b/c/config.properties").getAbsolutePath();
            ConfigManager nested = new ConfigManager(nestedPath);
            nested.loadConfiguration();

            assertTrue(new File(nestedPath).exists());
        }
    }

    // ───────── Validation ─────────

    @Nested
    @DisplayName("validation")
    class Validation {

        @BeforeEach
        void load() {
            configManager.loadConfiguration();
        }

        @Test
        @DisplayName("rejects a non-http broker URL")
        void badBrokerUrl() {
            configManager.overrideEndpoints("ftp://broker", "https://api", "https://mitid");
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> configManager.validate());
            assertTrue(e.getMessage().contains("brokerBaseUrl"));
        }

        @Test
        @DisplayName("rejects non-positive timings")
        void badTimings() {
            configManager.overrideTimings(0, 300, 30);
            assertThrows(IllegalStateException.class, () -> configManager.validate());
            configManager.overrideTimings(2000, 0, 30);
            assertThrows(IllegalStateException.class, () -> configManager.validate());
        }

        @Test
        @DisplayName("rejects a malformed proxy")
        void badProxy() {
            configManager.overrideProxy("localhost");
            assertThrows(IllegalStateException.class, () -> configManager.validate());
            configManager.overrideProxy("localhost:1080");
            assertDoesNotThrow(() -> configManager.validate());
        }

        @Test
        @DisplayName("proxy port must be in range")
        void proxyPortRange() {
            configManager.overrideProxy("localhost:99999");
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> configManager.validate());
            assertTrue(e.getMessage().contains("proxy"));
            configManager.overrideProxy("localhost:0");
            assertThrows(IllegalStateException.class, () -> configManager.validate());
        }

        @Test
        @DisplayName("accepts every proxy form the HTTP client accepts")
        void proxyForms() {
            configManager.overrideProxy("socks5://proxy.local:1080");
            assertDoesNotThrow(() -> configManager.validate());
            configManager.overrideProxy("");
            assertDoesNotThrow(() -> configManager.validate());
            configManager.overrideProxy("proxy local:1080");
            assertThrows(IllegalStateException.class, () -> configManager.validate());
        }

        @Test
        @DisplayName("rejects a zero redirect ceiling")
        void badRedirects() {
            configManager.overrideMaxRedirects(0);
            assertThrows(IllegalStateException.class, () -> configManager.validate());
        }
    }
}

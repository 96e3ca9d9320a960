package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.SessionArtifact;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SessionStoreTest {

    private Path tempDir;
    private Path sessionFile;
    private SessionStore store;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("nordnetportfolio-store");
        sessionFile = tempDir.resolve("state").resolve("session.json");
        store = new SessionStore(sessionFile, new OkHttpClient(), "http://localhost:1");
    }

    @AfterEach
    void cleanup() throws IOException {
        if (Files.exists(tempDir)) {
            try (Stream<Path> walk = Files.walk(tempDir)) {
                walk.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
            }
        }
    }

    private static SessionArtifact artifact(String cookieValue) {
        return new SessionArtifact(Map.of("NEXT", cookieValue), Map.of("ntag", "tag-" + cookieValue),
                Instant.parse("2026-02-19T10:30:00Z"), null);
    }

    @Nested
    @DisplayName("load and save")
    class LoadAndSave {

        @Test
        @DisplayName("nothing stored loads as null")
        void empty() {
            assertNull(store.load("user"));
            assertFalse(Files.exists(sessionFile));
        }

        @Test
        @DisplayName("saved session loads back equal, parent directories created")
        void roundTrip() {
            assertTrue(store.save("user", artifact("a")));
            assertTrue(Files.exists(sessionFile));
            assertEquals(artifact("a"), store.load("user"));
        }

        @Test
        @DisplayName("file carries the format version")
        void versioned() throws IOException {
            store.save("user", artifact("a"));
            JSONObject root = new JSONObject(Files.readString(sessionFile, StandardCharsets.UTF_8));
            assertEquals(SessionStore.FORMAT_VERSION, root.getInt("version"));
            assertTrue(root.getJSONObject("sessions").has("user"));
        }

        @Test
        @DisplayName("identifiers are kept apart and saves replace")
        void multipleIdentifiers() {
            store.save("one", artifact("a"));
            store.save("two", artifact("b"));
            store.save("one", artifact("c"));
            assertEquals(artifact("c"), store.load("one"));
            assertEquals(artifact("b"), store.load("two"));
        }

        @Test
        @DisplayName("file is readable only by its owner")
        void ownerOnly() throws IOException {
            assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
            store.save("user", artifact("a"));
            assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(sessionFile)));
        }

        @Test
        @DisplayName("no temporary files are left behind")
        void noTempFiles() throws IOException {
            store.save("user", artifact("a"));
            store.save("user", artifact("b"));
            try (Stream<Path> files = Files.list(sessionFile.getParent())) {
                assertEquals(1, files.count());
            }
        }

        @Test
        @DisplayName("corrupted file counts as no session and is overwritten by the next save")
        void corrupted() throws IOException {
            Files.createDirectories(sessionFile.getParent());
            Files.writeString(sessionFile, "{not json", StandardCharsets.UTF_8);
            assertNull(store.load("user"));
            assertTrue(store.save("user", artifact("a")));
            assertEquals(artifact("a"), store.load("user"));
        }

        @Test
        @DisplayName("file of another format version counts as no session and is not carried over")
        void unknownVersion() throws IOException {
            Files.createDirectories(sessionFile.getParent());
            JSONObject sessions = new JSONObject().put("user", artifact("old").toJson());
            Files.writeString(sessionFile, new JSONObject().put("version", 99).put("sessions", sessions).toString(),
                    StandardCharsets.UTF_8);

            assertNull(store.load("user"));

            assertTrue(store.save("other", artifact("b")));
            JSONObject root = new JSONObject(Files.readString(sessionFile, StandardCharsets.UTF_8));
            assertEquals(SessionStore.FORMAT_VERSION, root.getInt("version"));
            assertFalse(root.getJSONObject("sessions").has("user"));
            assertNull(store.load("user"));
        }

        @Test
        @DisplayName("missing version counts as no session")
        void missingVersion() throws IOException {
            Files.createDirectories(sessionFile.getParent());
            JSONObject sessions = new JSONObject().put("user", artifact("a").toJson());
            Files.writeString(sessionFile, new JSONObject().put("sessions", sessions).toString(), StandardCharsets.UTF_8);
            assertNull(store.load("user"));
        }

        @Test
        @DisplayName("malformed entry is ignored")
        void malformedEntry() throws IOException {
            Files.createDirectories(sessionFile.getParent());
            Files.writeString(sessionFile, "{\"version\":1,\"sessions\":{\"user\":{\"cookies\":{}}}}",
                    StandardCharsets.UTF_8);
            assertNull(store.load("user"));
        }

        @Test
        @DisplayName("write failure is reported, not thrown")
        void writeFailure() throws IOException {
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "file, not a directory");
            SessionStore broken = new SessionStore(blocker.resolve("session.json"), new OkHttpClient(), "http://localhost:1");
            assertFalse(broken.save("user", artifact("a")));
            assertNull(broken.load("user"));
        }
    }

    @Nested
    @DisplayName("invalidate")
    class Invalidate {

        @Test
        @DisplayName("removing the last session deletes the file")
        void deletesFile() {
            store.save("user", artifact("a"));
            store.invalidate("user");
            assertFalse(Files.exists(sessionFile));
            assertNull(store.load("user"));
        }

        @Test
        @DisplayName("other sessions survive")
        void keepsOthers() {
            store.save("one", artifact("a"));
            store.save("two", artifact("b"));
            store.invalidate("one");
            assertNull(store.load("one"));
            assertEquals(artifact("b"), store.load("two"));
        }

        @Test
        @DisplayName("unknown identifier is a no-op")
        void unknown() {
            assertDoesNotThrow(() -> store.invalidate("nobody"));
        }
    }

    @Nested
    @DisplayName("probe")
    class Probe {

        private MockWebServer server;
        private SessionStore probing;

        @BeforeEach
        void start() throws IOException {
            server = new MockWebServer();
            server.start();
            String base = server.url("/").toString();
            probing = new SessionStore(sessionFile, new OkHttpClient(), base.substring(0, base.length() - 1));
        }

        @AfterEach
        void stop() throws IOException {
            server.shutdown();
        }

        @Test
        @DisplayName("accounts listed means valid; session cookies and headers are sent")
        void valid() throws InterruptedException {
            server.enqueue(new MockResponse().setBody("[{\"accid\":1}]"));
            assertTrue(probing.probe(artifact("a")));

            RecordedRequest request = server.takeRequest();
            assertEquals("/api/2/accounts", request.getPath());
            assertEquals("NEXT=a", request.getHeader("Cookie"));
            assertEquals("tag-a", request.getHeader("ntag"));
        }

        @Test
        @DisplayName("401 means invalid")
        void unauthorized() {
            server.enqueue(new MockResponse().setResponseCode(401));
            assertFalse(probing.probe(artifact("a")));
        }

        @Test
        @DisplayName("empty account list means invalid")
        void noAccounts() {
            server.enqueue(new MockResponse().setBody("[]"));
            assertFalse(probing.probe(artifact("a")));
        }

        @Test
        @DisplayName("non-JSON body means invalid")
        void garbage() {
            server.enqueue(new MockResponse().setBody("<html>login</html>"));
            assertFalse(probing.probe(artifact("a")));
        }

        @Test
        @DisplayName("unreachable broker means invalid")
        void unreachable() {
            SessionStore offline = new SessionStore(sessionFile, new OkHttpClient(), "http://127.0.0.1:1");
            assertFalse(offline.probe(artifact("a")));
        }
    }
}

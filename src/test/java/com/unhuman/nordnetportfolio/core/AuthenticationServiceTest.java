package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.Credentials;
import com.unhuman.nordnetportfolio.model.SessionArtifact;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AuthenticationServiceTest {

    private Path tempDir;
    private ConfigManager config;
    private SessionStore store;
    private AuthenticationService service;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("nordnetportfolio-auth");
        config = new ConfigManager(tempDir.resolve("config.properties").toString());
        config.loadConfiguration();
        store = new SessionStore(tempDir.resolve("session.json"), new OkHttpClient(), "http://127.0.0.1:1");
    }

    @AfterEach
    void cleanup() throws IOException {
        if (service != null) {
            service.shutdown();
        }
        try (Stream<Path> walk = Files.walk(tempDir)) {
            walk.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
        }
    }

    private static SessionArtifact artifact(String userId) {
        return new SessionArtifact(Map.of("NEXT", "session-" + userId), Map.of("ntag", "tag"), Instant.now(), null);
    }

    /** Service whose attempts are supplied by the test instead of a real login. */
    private AuthenticationService scripted(Function<CancellationToken, SessionArtifact> attempt) {
        return new AuthenticationService(config, new HttpSessionFactory(config), store) {
            @Override
            protected SessionArtifact runAttempt(Credentials credentials, CancellationToken token,
                                                 AuthProgressListener listener) {
                return attempt.apply(token);
            }
        };
    }

    private static void awaitQuietly(CountDownLatch latch, CancellationToken token) {
        try {
            while (!latch.await(10, TimeUnit.MILLISECONDS)) {
                token.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AuthFlowException.cancelled();
        }
    }

    @Nested
    @DisplayName("results")
    class Results {

        @Test
        @DisplayName("successful login is saved")
        void saves() {
            service = scripted(token -> artifact("user-1"));
            SessionArtifact result = service.login(new Credentials("user-1"), null);
            assertEquals(result, store.load("user-1"));
        }

        @Test
        @DisplayName("failure reaches the caller unchanged and nothing is saved")
        void failure() {
            AuthFlowException timeout = AuthFlowException.timedOut(AuthFlowException.REASON_APPROVAL_TIMEOUT, "slow");
            service = scripted(token -> { throw timeout; });
            AuthFlowException e = assertThrows(AuthFlowException.class,
                    () -> service.login(new Credentials("user-1"), null));
            assertSame(timeout, e);
            assertNull(store.load("user-1"));
        }

        @Test
        @DisplayName("an Error in the attempt still completes the handle")
        void errorCompletesHandle() {
            service = scripted(token -> { throw new StackOverflowError("deep"); });
            LoginHandle handle = service.startLogin(new Credentials("user-1"), null);
            StackOverflowError e = assertThrows(StackOverflowError.class, () -> handle.await(5, TimeUnit.SECONDS));
            assertEquals("deep", e.getMessage());
            assertTrue(handle.isDone());
            assertNull(store.load("user-1"));
        }

        @Test
        @DisplayName("await with a timeout leaves the login running")
        void awaitTimeout() throws TimeoutException {
            CountDownLatch release = new CountDownLatch(1);
            service = scripted(token -> {
                awaitQuietly(release, token);
                return artifact("user-1");
            });
            LoginHandle handle = service.startLogin(new Credentials("user-1"), null);
            assertThrows(TimeoutException.class, () -> handle.await(50, TimeUnit.MILLISECONDS));
            assertFalse(handle.isDone());
            release.countDown();
            assertNotNull(handle.await(5, TimeUnit.SECONDS));
            assertEquals("user-1", handle.getUserId());
        }
    }

    @Nested
    @DisplayName("serialization")
    class Serialization {

        @Test
        @DisplayName("attempts for one user never overlap")
        void sameUser() throws Exception {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            service = scripted(token -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                running.decrementAndGet();
                return artifact("user-1");
            });

            LoginHandle first = service.startLogin(new Credentials("user-1"), null);
            LoginHandle second = service.startLogin(new Credentials("user-1"), null);
            LoginHandle third = service.startLogin(new Credentials("user-1"), null);
            assertNotNull(first.await(5, TimeUnit.SECONDS));
            assertNotNull(second.await(5, TimeUnit.SECONDS));
            assertNotNull(third.await(5, TimeUnit.SECONDS));
            assertEquals(1, maxRunning.get());
        }

        @Test
        @DisplayName("different users log in concurrently")
        void differentUsers() throws Exception {
            CountDownLatch bothRunning = new CountDownLatch(2);
            service = scripted(token -> {
                bothRunning.countDown();
                awaitQuietly(bothRunning, token);
                return artifact("any");
            });
            LoginHandle a = service.startLogin(new Credentials("user-a"), null);
            LoginHandle b = service.startLogin(new Credentials("user-b"), null);
            assertNotNull(a.await(5, TimeUnit.SECONDS));
            assertNotNull(b.await(5, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancel during the attempt leaves no stored session")
        void duringAttempt() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch never = new CountDownLatch(1);
            service = scripted(token -> {
                started.countDown();
                awaitQuietly(never, token);
                return artifact("user-1");
            });
            LoginHandle handle = service.startLogin(new Credentials("user-1"), null);
            assertTrue(started.await(5, TimeUnit.SECONDS));
            handle.cancel();

            AuthFlowException e = assertThrows(AuthFlowException.class, () -> handle.await(5, TimeUnit.SECONDS));
            assertTrue(e.isCancelled());
            assertTrue(handle.isCancelled());
            assertNull(store.load("user-1"));
            assertFalse(Files.exists(store.getSessionFile()));
        }

        @Test
        @DisplayName("attempt finishing after cancel is discarded")
        void finishesAfterCancel() {
            service = scripted(token -> {
                token.cancel();
                return artifact("user-1");
            });
            AuthFlowException e = assertThrows(AuthFlowException.class,
                    () -> service.login(new Credentials("user-1"), null));
            assertTrue(e.isCancelled());
            assertNull(store.load("user-1"));
        }

        @Test
        @DisplayName("cancel while queued behind another attempt never runs it")
        void whileQueued() throws Exception {
            AtomicInteger attempts = new AtomicInteger();
            CountDownLatch firstStarted = new CountDownLatch(1);
            CountDownLatch releaseFirst = new CountDownLatch(1);
            service = scripted(token -> {
                if (attempts.incrementAndGet() == 1) {
                    firstStarted.countDown();
                    awaitQuietly(releaseFirst, token);
                }
                return artifact("user-1");
            });

            LoginHandle first = service.startLogin(new Credentials("user-1"), null);
            assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
            LoginHandle second = service.startLogin(new Credentials("user-1"), null);
            second.cancel();

            AuthFlowException e = assertThrows(AuthFlowException.class, () -> second.await(5, TimeUnit.SECONDS));
            assertTrue(e.isCancelled());
            releaseFirst.countDown();
            assertNotNull(first.await(5, TimeUnit.SECONDS));
            assertEquals(1, attempts.get());
        }
    }
}

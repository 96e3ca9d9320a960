package com.unhuman.nordnetportfolio.core;

import com.unhuman.nordnetportfolio.model.SessionArtifact;
import com.unhuman.nordnetportfolio.util.LogCategory;
import com.unhuman.nordnetportfolio.util.LogManager;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.HashSet;
import java.util.Set;

/**
 * Persists session artifacts, keyed by user identifier, in a single JSON file readable only by
 * its owner. Storage problems are logged and never thrown: a file that cannot be read counts
 * as no session.
 */
public class SessionStore {
    static final int FORMAT_VERSION = 1;

    private final Path sessionFile;
    private final OkHttpClient httpClient;
    private final String brokerBaseUrl;

    public SessionStore(Path sessionFile, OkHttpClient httpClient, String brokerBaseUrl) {
        this.sessionFile = sessionFile;
        this.httpClient = httpClient;
        this.brokerBaseUrl = brokerBaseUrl;
    }

    public Path getSessionFile() {
        return sessionFile;
    }

    /**
     * @return the stored session for {@code identifier}, or null when there is none or it cannot be read
     */
    public synchronized SessionArtifact load(String identifier) {
        JSONObject sessions = readSessions();
        JSONObject entry = sessions.optJSONObject(identifier);
        if (entry == null) {
            return null;
        }
        try {
            SessionArtifact artifact = SessionArtifact.fromJson(entry);
            LogManager.getInstance().info(LogCategory.SESSION,
                    "Loaded stored session for " + identifier + " (issued " + artifact.getIssuedAt() + ")");
            return artifact;
        } catch (IllegalArgumentException e) {
            LogManager.getInstance().warn(LogCategory.SESSION,
                    "Ignoring unreadable stored session for " + identifier + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Replace the stored session for {@code identifier}. The file is written to a temporary
     * sibling and moved into place, so readers see the old or the new content, never a mix.
     *
     * @return false if the session could not be written
     */
    public synchronized boolean save(String identifier, SessionArtifact artifact) {
        JSONObject sessions = readSessions();
        sessions.put(identifier, artifact.toJson());
        if (writeSessions(sessions)) {
            LogManager.getInstance().info(LogCategory.SESSION, "Saved session for " + identifier + " to " + sessionFile);
            return true;
        }
        return false;
    }

    /**
     * Remove the stored session for {@code identifier}; the file goes away with its last session.
     */
    public synchronized void invalidate(String identifier) {
        JSONObject sessions = readSessions();
        if (sessions.remove(identifier) == null) {
            return;
        }
        if (sessions.isEmpty()) {
            try {
                Files.deleteIfExists(sessionFile);
            } catch (IOException e) {
                LogManager.getInstance().error(LogCategory.SESSION,
                        "Could not delete session file " + sessionFile + ": " + e.getMessage());
            }
        } else {
            writeSessions(sessions);
        }
        LogManager.getInstance().info(LogCategory.SESSION, "Invalidated stored session for " + identifier);
    }

    /**
     * Ask the broker whether {@code artifact} still works: the accounts endpoint must answer
     * 200 with at least one account. Network failures count as invalid.
     */
    public boolean probe(SessionArtifact artifact) {
        Request request = SessionHeaders.apply(new Request.Builder().url(brokerBaseUrl + "/api/2/accounts").get(), artifact)
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                LogManager.getInstance().info(LogCategory.SESSION, "Stored session rejected by broker (status " + response.code() + ")");
                return false;
            }
            ResponseBody body = response.body();
            JSONArray accounts = new JSONArray(body != null ? body.string() : "");
            return !accounts.isEmpty();
        } catch (IOException e) {
            LogManager.getInstance().warn(LogCategory.SESSION, "Could not validate stored session: " + e.getMessage());
            return false;
        } catch (JSONException e) {
            LogManager.getInstance().warn(LogCategory.SESSION, "Session probe returned an unexpected body");
            return false;
        }
    }

    private JSONObject readSessions() {
        if (!Files.exists(sessionFile)) {
            return new JSONObject();
        }
        try {
            JSONObject root = new JSONObject(Files.readString(sessionFile, StandardCharsets.UTF_8));
            int version = root.optInt("version", -1);
            if (version != FORMAT_VERSION) {
                LogManager.getInstance().warn(LogCategory.SESSION,
                        "Session file " + sessionFile + " has unsupported version " + version + ", treating it as empty");
                return new JSONObject();
            }
            JSONObject sessions = root.optJSONObject("sessions");
            return sessions != null ? sessions : new JSONObject();
        } catch (IOException | JSONException e) {
            LogManager.getInstance().warn(LogCategory.SESSION,
                    "Session file " + sessionFile + " is unreadable, treating it as empty: " + e.getMessage());
            return new JSONObject();
        }
    }

    private boolean writeSessions(JSONObject sessions) {
        JSONObject root = new JSONObject()
                .put("version", FORMAT_VERSION)
                .put("sessions", sessions);
        Path directory = sessionFile.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = createOwnerOnlyTempFile(directory);
            Files.writeString(temp, root.toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(temp, sessionFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, sessionFile, StandardCopyOption.REPLACE_EXISTING);
            }
            restrictToOwner(sessionFile);
            return true;
        } catch (IOException e) {
            LogManager.getInstance().error(LogCategory.SESSION,
                    "Error writing session file " + sessionFile + ": " + e.getMessage());
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    LogManager.getInstance().warn(LogCategory.SESSION, "Could not remove temp file " + temp);
                }
            }
            return false;
        }
    }

    private Path createOwnerOnlyTempFile(Path directory) throws IOException {
        String prefix = sessionFile.getFileName() + ".";
        try {
            return Files.createTempFile(directory, prefix, ".tmp",
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        } catch (UnsupportedOperationException e) {
            // Not a POSIX filesystem (e.g., Windows)
            return Files.createTempFile(directory, prefix, ".tmp");
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        try {
            Set<PosixFilePermission> perms = new HashSet<>();
            perms.add(PosixFilePermission.OWNER_READ);
            perms.add(PosixFilePermission.OWNER_WRITE);
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException e) {
            // Not a POSIX filesystem (e.g., Windows), skip
        }
    }
}

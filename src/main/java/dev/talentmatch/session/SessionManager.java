package dev.talentmatch.session;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Allocates ranking sessions and owns their temporary file storage.
 *
 * <p>Each session gets a directory {@code {baseDir}/{sessionId}}. Live sessions are tracked in a
 * {@link ConcurrentHashMap}; {@link #cleanup(SessionId)} removes the session from that map before
 * touching the disk, so any ingestion still running for it fails closed via {@link
 * #requireActive(SessionId)}.
 *
 * <p>Tracking is in-memory only. After a restart no session is active and leftover directories
 * are reclaimed by {@link #findExpired()} and the scheduled sweep.
 */
@Component
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final ConcurrentHashMap<SessionId, Instant> activeSessions = new ConcurrentHashMap<>();
  private final SessionProperties properties;
  private final Clock clock;

  public SessionManager(SessionProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Creates a new session with an empty storage directory.
   *
   * @return the new session id
   * @throws SessionStorageException if the directory cannot be created
   */
  public SessionId create() {
    SessionId sessionId = SessionId.random();
    Path dir = sessionDir(sessionId);
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      log.error("Could not create directory for session {}: {}", sessionId, e.getMessage());
      throw new SessionStorageException("Could not create session directory " + dir, e);
    }
    activeSessions.put(sessionId, clock.instant());
    log.info("Created session {}", sessionId);
    return sessionId;
  }

  /**
   * Stores an uploaded file inside the session directory.
   *
   * @param sessionId the owning session
   * @param filename plain file name; names carrying path separators or dot segments are rejected
   * @param content file bytes
   * @return absolute path of the stored file
   * @throws IllegalArgumentException if the filename would escape the session directory
   * @throws SessionClosedException if the session is not active
   * @throws SessionStorageException if the write fails
   */
  public Path save(SessionId sessionId, String filename, byte[] content) {
    requireActive(sessionId);
    Path target = resolveInside(sessionId, filename);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, content);
    } catch (IOException e) {
      log.error("Could not save {} for session {}: {}", filename, sessionId, e.getMessage());
      throw new SessionStorageException("Could not save " + filename, e);
    }
    log.debug("Saved {} ({} bytes) to session {}", filename, content.length, sessionId);
    return target.toAbsolutePath();
  }

  /**
   * Looks up a stored file for download.
   *
   * @return the file path, or empty if no such file exists in the session
   * @throws IllegalArgumentException if the filename would escape the session directory
   */
  public Optional<Path> resolve(SessionId sessionId, String filename) {
    Path target = resolveInside(sessionId, filename);
    return Files.isRegularFile(target) ? Optional.of(target.toAbsolutePath()) : Optional.empty();
  }

  public boolean isActive(SessionId sessionId) {
    return activeSessions.containsKey(sessionId);
  }

  /**
   * Guards work that must not run against a torn-down session.
   *
   * @throws SessionClosedException if the session is not active
   */
  public void requireActive(SessionId sessionId) {
    if (!isActive(sessionId)) {
      throw new SessionClosedException(sessionId);
    }
  }

  /**
   * Marks the session closed without touching its storage. Subsequent {@link
   * #requireActive(SessionId)} calls fail.
   *
   * @return true if the session was active
   */
  public boolean deactivate(SessionId sessionId) {
    return activeSessions.remove(sessionId) != null;
  }

  /**
   * Closes the session and deletes its directory tree. Safe to call repeatedly and on sessions
   * whose directory was never fully populated.
   *
   * @return true if a directory was removed, false if there was nothing to remove
   * @throws SessionStorageException if the directory exists but cannot be deleted
   */
  public boolean cleanup(SessionId sessionId) {
    deactivate(sessionId);
    Path dir = sessionDir(sessionId);
    if (!Files.exists(dir)) {
      log.debug("Session {} has no storage left, nothing to clean up", sessionId);
      return false;
    }
    try {
      boolean removed = FileSystemUtils.deleteRecursively(dir);
      log.info("Cleaned up session {}", sessionId);
      return removed;
    } catch (IOException e) {
      log.error("Could not clean up session {}: {}", sessionId, e.getMessage());
      throw new SessionStorageException("Could not delete session directory " + dir, e);
    }
  }

  /**
   * Lists every session directory whose last-modified time is older than the configured max age,
   * whether or not the session is still tracked as active. Directories that are not named after a
   * session id are left out. Nothing is deleted; the caller removes vectors first, then files.
   *
   * @return ids of the expired sessions
   */
  public List<SessionId> findExpired() {
    Path baseDir = properties.baseDir();
    if (!Files.isDirectory(baseDir)) {
      return List.of();
    }
    Instant cutoff = clock.instant().minus(properties.maxAge());
    List<SessionId> expired = new ArrayList<>();
    try (DirectoryStream<Path> dirs = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
      for (Path dir : dirs) {
        Optional<SessionId> sessionId = parseSessionId(dir.getFileName().toString());
        if (sessionId.isEmpty()) {
          continue;
        }
        try {
          if (Files.getLastModifiedTime(dir).toInstant().isBefore(cutoff)) {
            expired.add(sessionId.get());
          }
        } catch (IOException e) {
          log.warn("Could not read age of session {}: {}", sessionId.get(), e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new SessionStorageException("Could not list session directory " + baseDir, e);
    }
    return expired;
  }

  Path sessionDir(SessionId sessionId) {
    return properties.baseDir().resolve(sessionId.value());
  }

  private Path resolveInside(SessionId sessionId, String filename) {
    if (filename == null
        || filename.isBlank()
        || filename.contains("/")
        || filename.contains("\\")
        || filename.indexOf('\0') >= 0
        || ".".equals(filename.strip())
        || "..".equals(filename.strip())) {
      throw new IllegalArgumentException("Invalid file name: " + filename);
    }
    Path dir = sessionDir(sessionId).toAbsolutePath().normalize();
    Path target = dir.resolve(filename).normalize();
    if (!dir.equals(target.getParent())) {
      throw new IllegalArgumentException("File name escapes the session directory: " + filename);
    }
    return target;
  }

  private static Optional<SessionId> parseSessionId(String name) {
    try {
      return Optional.of(SessionId.of(name));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}

package dev.talentmatch.session;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of one ranking session: the isolation boundary for its uploaded files and vectors.
 *
 * <p>Always a canonical UUID string, so an id can be used as a directory name and a metadata
 * filter value without escaping.
 *
 * @param value canonical lower-case UUID string
 */
public record SessionId(String value) {

  public SessionId {
    Objects.requireNonNull(value, "value must not be null");
    UUID parsed;
    try {
      parsed = UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Session id must be a canonical UUID: " + value, e);
    }
    if (!parsed.toString().equals(value)) {
      throw new IllegalArgumentException("Session id must be a canonical UUID: " + value);
    }
  }

  /** Allocates a fresh random session id. */
  public static SessionId random() {
    return new SessionId(UUID.randomUUID().toString());
  }

  /** Parses a session id received from a caller (path variable, directory name). */
  public static SessionId of(String value) {
    return new SessionId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}

package dev.talentmatch.session;

/** A session file could not be written, read or deleted. */
public class SessionStorageException extends RuntimeException {

  public SessionStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
